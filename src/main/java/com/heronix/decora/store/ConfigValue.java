package com.heronix.decora.store;

import java.util.Objects;
import java.util.Optional;

/**
 * A single configuration value tagged with its kind.
 *
 * The text form is canonical for every kind: INT holds a decimal integer,
 * BOOL holds "true" or "false", ENCRYPTED_STRING holds the Base64 blob.
 */
public record ConfigValue(ConfigValueType type, String text) {

    public ConfigValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public static ConfigValue ofString(String value) {
        return new ConfigValue(ConfigValueType.STRING, value);
    }

    public static ConfigValue ofInt(int value) {
        return new ConfigValue(ConfigValueType.INT, Integer.toString(value));
    }

    public static ConfigValue ofBool(boolean value) {
        return new ConfigValue(ConfigValueType.BOOL, Boolean.toString(value));
    }

    public static ConfigValue encrypted(String blob) {
        return new ConfigValue(ConfigValueType.ENCRYPTED_STRING, blob);
    }

    public boolean isEncrypted() {
        return type == ConfigValueType.ENCRYPTED_STRING;
    }

    /**
     * Integer reading of a plain value. Empty for encrypted values and for
     * text that is not a decimal integer.
     */
    public Optional<Integer> asInt() {
        if (isEncrypted()) {
            return Optional.empty();
        }
        return parseInt(text);
    }

    /**
     * Boolean reading of a plain value ("true"/"false", case-insensitive).
     */
    public Optional<Boolean> asBool() {
        if (isEncrypted()) {
            return Optional.empty();
        }
        return parseBool(text);
    }

    static Optional<Integer> parseInt(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<Boolean> parseBool(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        // never print blobs
        return isEncrypted() ? "ConfigValue[ENCRYPTED_STRING]" : "ConfigValue[" + type + "=" + text + "]";
    }
}
