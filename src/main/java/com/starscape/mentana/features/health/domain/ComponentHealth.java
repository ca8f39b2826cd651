package com.starscape.mentana.features.health.domain;

/**
 * Result of probing one component.
 *
 * @param name      component name, e.g. "user-repository"
 * @param required  whether the component counts towards the composite status
 * @param reachable whether the probe answered in time and reported success
 * @param detail    diagnostic detail, may be null
 * @param latencyMs time spent waiting for the probe
 */
public record ComponentHealth(
    String name,
    boolean required,
    boolean reachable,
    String detail,
    long latencyMs
) {
}
