package com.starscape.mentana.features.health.app;

import com.starscape.mentana.features.health.domain.ComponentHealth;
import com.starscape.mentana.features.health.domain.HealthReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the composite adapter health to Spring Boot Actuator.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every required adapter reachable</li>
 *   <li>DEGRADED: at least one required adapter reachable</li>
 *   <li>DOWN: no required adapter reachable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component("adapters")
public class AdapterHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final HealthAggregator aggregator;

    public AdapterHealthIndicator(HealthAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public Health health() {
        HealthReport report = aggregator.check();
        Health.Builder builder = switch (report.status()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };
        for (ComponentHealth component : report.components()) {
            builder.withDetail(component.name(), componentDetail(component));
        }
        return builder.build();
    }

    private Map<String, Object> componentDetail(ComponentHealth component) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", component.reachable() ? "reachable" : "unreachable");
        detail.put("required", component.required());
        if (component.detail() != null) {
            detail.put("detail", component.detail());
        }
        detail.put("latencyMs", component.latencyMs());
        return detail;
    }
}
