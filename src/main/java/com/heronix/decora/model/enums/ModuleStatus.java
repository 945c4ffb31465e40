package com.heronix.decora.model.enums;

/**
 * Lifecycle status of the device registry module.
 */
public enum ModuleStatus {
    UNINITIALIZED,
    INITIALIZING,
    INITIALIZED,
    RUNNING,
    ERROR,
    SHUTDOWN
}
