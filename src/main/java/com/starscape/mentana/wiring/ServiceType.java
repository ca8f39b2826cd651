package com.starscape.mentana.wiring;

/**
 * Non-persistence external capabilities that have a service port.
 */
public enum ServiceType {
    FILE_STORAGE("file-storage");

    private final String componentName;

    ServiceType(String componentName) {
        this.componentName = componentName;
    }

    public String componentName() {
        return componentName;
    }
}
