package com.starscape.mentana.features.health.api;

import com.starscape.mentana.features.health.api.dto.HealthResponse;
import com.starscape.mentana.features.health.app.HealthAggregator;
import com.starscape.mentana.features.health.domain.HealthReport;
import com.starscape.mentana.features.health.domain.HealthState;
import com.starscape.mentana.wiring.AdapterDescription;
import com.starscape.mentana.wiring.RepositoryFactory;
import com.starscape.mentana.wiring.ServiceFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Health endpoints for load balancers and operators.
 * Only UNHEALTHY turns into 503; DEGRADED still serves traffic.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthAggregator healthAggregator;
    private final RepositoryFactory repositoryFactory;
    private final ServiceFactory serviceFactory;

    public HealthController(
            HealthAggregator healthAggregator,
            RepositoryFactory repositoryFactory,
            ServiceFactory serviceFactory) {
        this.healthAggregator = healthAggregator;
        this.repositoryFactory = repositoryFactory;
        this.serviceFactory = serviceFactory;
    }

    /**
     * Full report with per-component detail and adapter wiring.
     * GET /health
     */
    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        HealthReport report = healthAggregator.check();
        List<AdapterDescription> adapters = new ArrayList<>(repositoryFactory.describe());
        adapters.addAll(serviceFactory.describe());
        return ResponseEntity.status(statusFor(report.status()))
                .body(HealthResponse.from(report, adapters));
    }

    /**
     * GET /health/live
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> live() {
        return ResponseEntity.ok(Map.<String, Object>of("status", "ALIVE", "checked_at", Instant.now()));
    }

    /**
     * GET /health/ready
     */
    @GetMapping("/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthReport report = healthAggregator.check();
        return ResponseEntity.status(statusFor(report.status()))
                .body(HealthResponse.from(report, null));
    }

    static HttpStatus statusFor(HealthState state) {
        return state == HealthState.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    }
}
