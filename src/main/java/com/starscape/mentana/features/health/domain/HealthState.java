package com.starscape.mentana.features.health.domain;

import java.util.List;

/**
 * Composite verdict over all monitored components.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /**
     * HEALTHY when every required component is reachable, DEGRADED when at least one is,
     * UNHEALTHY otherwise. Optional components never change the verdict.
     */
    public static HealthState of(List<ComponentHealth> components) {
        long required = components.stream().filter(ComponentHealth::required).count();
        long reachable = components.stream()
                .filter(ComponentHealth::required)
                .filter(ComponentHealth::reachable)
                .count();
        if (reachable == required) {
            return HEALTHY;
        }
        return reachable > 0 ? DEGRADED : UNHEALTHY;
    }
}
