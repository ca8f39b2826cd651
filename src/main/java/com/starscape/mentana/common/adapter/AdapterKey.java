package com.starscape.mentana.common.adapter;

import java.util.Objects;

/**
 * Identifies one memoized adapter: the port it implements and the backend behind it.
 */
public record AdapterKey<P>(
    Class<P> port,
    BackendType backend
) {

    public AdapterKey {
        Objects.requireNonNull(port, "port");
        Objects.requireNonNull(backend, "backend");
    }

    public static <P> AdapterKey<P> of(Class<P> port, BackendType backend) {
        return new AdapterKey<>(port, backend);
    }

    @Override
    public String toString() {
        return port.getSimpleName() + "/" + backend.configName();
    }
}
