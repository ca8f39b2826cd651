package com.starscape.mentana.common.adapter;

import com.starscape.mentana.common.exception.ConfigurationException;

import java.util.Locale;

/**
 * Storage and service backends an adapter can be built for.
 * Factories switch over this enum exhaustively; configuration strings are parsed once, here.
 */
public enum BackendType {
    DYNAMODB("dynamodb"),
    MEMORY("memory"),
    S3("s3");

    private final String configName;

    BackendType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Case-insensitive lookup by configuration name.
     *
     * @throws ConfigurationException naming the requested type when it is unknown
     */
    public static BackendType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (BackendType type : values()) {
                if (type.configName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw ConfigurationException.unknownBackend(name);
    }
}
