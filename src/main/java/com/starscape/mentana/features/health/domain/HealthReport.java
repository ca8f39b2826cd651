package com.starscape.mentana.features.health.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One snapshot of all probes. Never stored.
 */
public record HealthReport(
    HealthState status,
    List<ComponentHealth> components,
    Instant checkedAt
) {

    public HealthReport {
        components = List.copyOf(components);
    }

    public Optional<ComponentHealth> component(String name) {
        return components.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
