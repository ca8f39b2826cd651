package com.starscape.mentana.features.health.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.mentana.features.health.domain.ComponentHealth;
import com.starscape.mentana.features.health.domain.HealthReport;
import com.starscape.mentana.wiring.AdapterDescription;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    String status,
    List<ComponentStatus> components,
    List<AdapterDescription> adapters,
    @JsonProperty("checked_at") Instant checkedAt
) {

    public static HealthResponse from(HealthReport report, List<AdapterDescription> adapters) {
        List<ComponentStatus> components = report.components().stream()
                .map(ComponentStatus::from)
                .toList();
        return new HealthResponse(report.status().name(), components, adapters, report.checkedAt());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComponentStatus(
        String name,
        boolean required,
        boolean reachable,
        String detail,
        @JsonProperty("latency_ms") long latencyMs
    ) {

        static ComponentStatus from(ComponentHealth component) {
            return new ComponentStatus(component.name(), component.required(), component.reachable(),
                    component.detail(), component.latencyMs());
        }
    }
}
