package com.starscape.mentana.wiring;

/**
 * Snapshot of how one port is wired.
 *
 * @param component  component name, e.g. "user-repository"
 * @param backend    configured backend name as written in configuration
 * @param created    whether the default instance has been built yet
 */
public record AdapterDescription(
    String component,
    String backend,
    boolean created
) {
}
