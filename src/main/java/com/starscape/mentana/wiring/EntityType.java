package com.starscape.mentana.wiring;

/**
 * Entity types that have a repository port.
 */
public enum EntityType {
    USER("user-repository");

    private final String componentName;

    EntityType(String componentName) {
        this.componentName = componentName;
    }

    /**
     * Name used in configuration, health reports and logs.
     */
    public String componentName() {
        return componentName;
    }
}
