package com.heronix.decora.service;

import java.time.Instant;

import com.heronix.decora.model.enums.ModuleErrorType;
import com.heronix.decora.model.enums.ModuleStatus;

/**
 * Observer for {@link DeviceRegistryService} status changes and errors.
 */
public interface ModuleEventListener {

    default void onStatusChanged(ModuleStatus previous, ModuleStatus current) {
    }

    default void onError(ModuleError error) {
    }

    record ModuleError(ModuleErrorType type, String message, Instant timestamp) {}
}
