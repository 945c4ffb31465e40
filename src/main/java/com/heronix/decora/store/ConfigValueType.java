package com.heronix.decora.store;

/**
 * Kind of value held by a configuration entry.
 */
public enum ConfigValueType {

    /**
     * Plain string, stored as a bare JSON string
     */
    STRING,

    /**
     * Plain integer, stored as a bare JSON number
     */
    INT,

    /**
     * Plain boolean, stored as a bare JSON boolean
     */
    BOOL,

    /**
     * Encrypted string, stored as {"isEncrypted": true, "value": "<blob>"}
     */
    ENCRYPTED_STRING
}
