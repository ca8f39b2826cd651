package com.starscape.mentana.common.health;

/**
 * Answer of a single liveness probe.
 *
 * @param reachable whether the backend answered
 * @param detail    optional diagnostic, may be null
 */
public record ProbeResult(
    boolean reachable,
    String detail
) {

    public static ProbeResult reachable(String detail) {
        return new ProbeResult(true, detail);
    }

    public static ProbeResult unreachable(String detail) {
        return new ProbeResult(false, detail);
    }
}
