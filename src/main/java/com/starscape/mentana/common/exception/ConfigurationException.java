package com.starscape.mentana.common.exception;

/**
 * Unknown backend type or missing required setting.
 * Fatal for the resolution call that hit it; never answered with a default backend.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static ConfigurationException unknownBackend(String requested) {
        return new ConfigurationException("Unsupported backend type: '" + requested + "'");
    }

    public static ConfigurationException missingSetting(String property, String backend) {
        return new ConfigurationException(
            String.format("Property '%s' is required for backend '%s'", property, backend));
    }
}
