package com.heronix.decora.store;

/**
 * Result of loading the configuration file.
 */
public enum LoadOutcome {

    /**
     * File was read and its entries merged into the store
     */
    LOADED,

    /**
     * No file at the configured path; the store was left unchanged
     */
    NOT_FOUND
}
