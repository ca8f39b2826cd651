package com.starscape.mentana.features.health.app;

import com.starscape.mentana.common.health.LivenessProbe;
import com.starscape.mentana.common.health.ProbeResult;
import com.starscape.mentana.features.health.domain.ComponentHealth;
import com.starscape.mentana.features.health.domain.HealthReport;
import com.starscape.mentana.features.health.domain.HealthState;
import com.starscape.mentana.features.health.domain.RegisteredProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered liveness probe and merges the answers into one {@link HealthReport}.
 *
 * <p>All probes start together on the probe executor and share a single deadline, so a check
 * never takes much longer than the configured timeout no matter how many probes hang. A probe
 * that misses the deadline is cancelled and reported unreachable; one that throws is reported
 * unreachable with the exception message. Neither affects the other probes.</p>
 *
 * <p>No state is kept between checks and nothing is retried.</p>
 */
public class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final List<RegisteredProbe> probes;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final Clock clock;

    public HealthAggregator(List<RegisteredProbe> probes, AsyncTaskExecutor executor, Duration timeout) {
        this(probes, executor, timeout, Clock.systemUTC());
    }

    HealthAggregator(List<RegisteredProbe> probes, AsyncTaskExecutor executor, Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Health check timeout must be positive");
        }
        this.probes = List.copyOf(probes);
        this.executor = executor;
        this.timeout = timeout;
        this.clock = clock;
    }

    public HealthReport check() {
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();

        List<Future<ProbeResult>> pending = new ArrayList<>(probes.size());
        for (RegisteredProbe registered : probes) {
            pending.add(submit(registered));
        }

        List<ComponentHealth> components = new ArrayList<>(probes.size());
        for (int i = 0; i < probes.size(); i++) {
            components.add(await(probes.get(i), pending.get(i), startedAt, deadline));
        }

        HealthState status = HealthState.of(components);
        if (status != HealthState.HEALTHY) {
            log.warn("Health check completed: status={}, unreachable={}", status, unreachableNames(components));
        } else {
            log.debug("Health check completed: status={}", status);
        }
        return new HealthReport(status, components, clock.instant());
    }

    private Future<ProbeResult> submit(RegisteredProbe registered) {
        try {
            return executor.submit(() -> {
                LivenessProbe probe = registered.probe().get();
                return probe.probe();
            });
        } catch (TaskRejectedException e) {
            log.warn("Probe {} rejected by executor: {}", registered.name(), e.getMessage());
            return null;
        }
    }

    private ComponentHealth await(RegisteredProbe registered, Future<ProbeResult> future,
                                  long startedAt, long deadline) {
        if (future == null) {
            return unreachable(registered, "probe rejected: executor saturated", startedAt);
        }
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            ProbeResult result = future.get(remaining, TimeUnit.NANOSECONDS);
            if (result == null) {
                return unreachable(registered, "probe returned no result", startedAt);
            }
            return new ComponentHealth(registered.name(), registered.required(), result.reachable(),
                    result.detail(), elapsedMillis(startedAt));
        } catch (TimeoutException e) {
            future.cancel(true);
            return unreachable(registered, "timed out after " + timeout.toMillis() + " ms", startedAt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe {} failed: {}", registered.name(), cause.toString());
            return unreachable(registered, describe(cause), startedAt);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return unreachable(registered, "interrupted while waiting for probe", startedAt);
        }
    }

    private static ComponentHealth unreachable(RegisteredProbe registered, String detail, long startedAt) {
        return new ComponentHealth(registered.name(), registered.required(), false, detail, elapsedMillis(startedAt));
    }

    private static long elapsedMillis(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static List<String> unreachableNames(List<ComponentHealth> components) {
        return components.stream()
                .filter(c -> !c.reachable())
                .map(ComponentHealth::name)
                .toList();
    }
}
