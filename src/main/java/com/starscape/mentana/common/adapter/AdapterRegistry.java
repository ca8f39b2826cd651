package com.starscape.mentana.common.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide cache of adapter instances, one per {@link AdapterKey}.
 *
 * <p>Hits are plain reads of a concurrent map. A miss takes the construction lock, checks
 * again and builds, so concurrent first resolutions of the same key converge on a single
 * instance. Only construction runs under the lock; calls made through a resolved adapter
 * never do.</p>
 *
 * <p>Owned by the application context and passed to the factories explicitly.</p>
 */
public class AdapterRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<AdapterKey<?>, Object> instances = new ConcurrentHashMap<>();
    private final ReentrantLock constructionLock = new ReentrantLock();

    /**
     * Returns the cached adapter for the key, building it with the constructor on first use.
     * If the constructor throws, nothing is cached and the exception propagates.
     */
    public <P> P resolve(AdapterKey<P> key, Supplier<? extends P> constructor) {
        Object existing = instances.get(key);
        if (existing != null) {
            return key.port().cast(existing);
        }
        constructionLock.lock();
        try {
            existing = instances.get(key);
            if (existing != null) {
                return key.port().cast(existing);
            }
            P created = Objects.requireNonNull(constructor.get(), () -> "Constructor returned null for " + key);
            instances.put(key, created);
            log.info("Adapter instance created: {} -> {}", key, created.getClass().getSimpleName());
            return created;
        } finally {
            constructionLock.unlock();
        }
    }

    <P> Optional<P> peek(AdapterKey<P> key) {
        return Optional.ofNullable(instances.get(key)).map(key.port()::cast);
    }

    public boolean isCreated(AdapterKey<?> key) {
        return instances.containsKey(key);
    }

    public int size() {
        return instances.size();
    }

    /**
     * Drops every cached instance, closing the ones that hold resources.
     * The next resolution builds fresh adapters.
     */
    public void reset() {
        constructionLock.lock();
        try {
            List<Object> removed = new ArrayList<>(instances.values());
            instances.clear();
            removed.forEach(AdapterRegistry::closeQuietly);
            log.info("Adapter registry reset, {} instances released", removed.size());
        } finally {
            constructionLock.unlock();
        }
    }

    @Override
    public void close() {
        reset();
    }

    private static void closeQuietly(Object adapter) {
        if (adapter instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close adapter {}: {}", adapter.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
