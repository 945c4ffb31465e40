package com.heronix.decora.model.enums;

/**
 * Category of an error reported by the device registry module.
 */
public enum ModuleErrorType {
    INITIALIZATION_ERROR,
    SHUTDOWN_ERROR,
    DEVICE_ERROR,
    COMMAND_ERROR,
    COMMUNICATION_ERROR,
    MODULE_NOT_INITIALIZED
}
