package com.starscape.mentana.wiring;

import com.starscape.mentana.common.config.AppProperties;
import com.starscape.mentana.features.health.app.HealthAggregator;
import com.starscape.mentana.features.health.domain.RegisteredProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers one liveness probe per repository and service port and builds the aggregator.
 */
@Configuration
public class HealthConfig {

    static final int MAX_PROBE_THREADS = 32;

    /**
     * Dedicated pool for probes so a hanging backend cannot starve request threads.
     *
     * <p>No queue: every probe gets a thread of its own right away. A probe stuck in blocking
     * I/O keeps its thread after cancellation, and a queued probe would wait behind it and miss
     * its deadline. When the pool is exhausted the submission is rejected and the aggregator
     * reports that component unreachable.</p>
     */
    @Bean
    public ThreadPoolTaskExecutor healthProbeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(MAX_PROBE_THREADS);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("health-probe-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public HealthAggregator healthAggregator(RepositoryFactory repositoryFactory,
                                             ServiceFactory serviceFactory,
                                             AppProperties properties,
                                             ThreadPoolTaskExecutor healthProbeExecutor) {
        AppProperties.Health health = properties.getHealth();
        List<RegisteredProbe> probes = new ArrayList<>();
        for (EntityType entityType : EntityType.values()) {
            String name = entityType.componentName();
            probes.add(new RegisteredProbe(name, health.isRequired(name),
                    () -> repositoryFactory.resolveRepository(entityType)));
        }
        for (ServiceType serviceType : ServiceType.values()) {
            String name = serviceType.componentName();
            probes.add(new RegisteredProbe(name, health.isRequired(name),
                    () -> serviceFactory.resolveService(serviceType)));
        }
        return new HealthAggregator(probes, healthProbeExecutor, health.getTimeout());
    }
}
