package com.heronix.decora.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.heronix.decora.crypto.CredentialCipher;
import com.heronix.decora.exception.ConfigLoadException;
import com.heronix.decora.exception.ConfigSaveException;
import com.heronix.decora.exception.DecryptionException;
import com.heronix.decora.exception.KeyCorruptException;
import com.heronix.decora.exception.KeyFileAccessException;

import lombok.extern.slf4j.Slf4j;

/**
 * Key/value configuration with optional per-entry encryption and JSON persistence.
 *
 * File format: one flat JSON object. Plain entries are bare scalars; encrypted
 * entries are written as {"isEncrypted": true, "value": "<base64 IV+ciphertext>"}.
 *
 * Changes are kept in memory until {@link #save()} is called. Saving rewrites the
 * whole file in place, so an interrupted write can leave a damaged file behind.
 *
 * Not thread-safe: load, save and mutation must not run concurrently on one instance.
 */
@Slf4j
public class ConfigStore {

    public static final String ENCRYPTED_FLAG_FIELD = "isEncrypted";
    public static final String ENCRYPTED_VALUE_FIELD = "value";

    public static final String KEY_HOST = "host";
    public static final String KEY_PORT = "port";
    public static final String KEY_USERNAME = "username";

    private static final List<String> REQUIRED_KEYS = List.of(KEY_HOST, KEY_PORT, KEY_USERNAME);

    private final Path configPath;
    private final CredentialCipher cipher;
    private final ObjectMapper objectMapper;
    private final Map<String, ConfigValue> entries = new LinkedHashMap<>();

    public ConfigStore(Path configPath, CredentialCipher cipher) {
        this(configPath, cipher, new ObjectMapper());
    }

    public ConfigStore(Path configPath, CredentialCipher cipher, ObjectMapper objectMapper) {
        this.configPath = configPath;
        this.cipher = cipher;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ========================================================================
    // WRITE ACCESS
    // ========================================================================

    /**
     * Set a string value, encrypting it first when {@code encrypt} is true.
     */
    public void set(String key, String value, boolean encrypt) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Configuration value for '" + key + "' cannot be null.");
        }

        entries.put(key, encrypt ? ConfigValue.encrypted(cipher.encrypt(value)) : ConfigValue.ofString(value));
    }

    public void set(String key, String value) {
        set(key, value, false);
    }

    public void setInt(String key, int value) {
        requireKey(key);
        entries.put(key, ConfigValue.ofInt(value));
    }

    public void setBool(String key, boolean value) {
        requireKey(key);
        entries.put(key, ConfigValue.ofBool(value));
    }

    public boolean remove(String key) {
        return entries.remove(key) != null;
    }

    // ========================================================================
    // READ ACCESS
    // ========================================================================

    /**
     * Get a value as text, decrypting encrypted entries.
     *
     * @throws DecryptionException if an encrypted entry cannot be decrypted
     */
    public String get(String key, String defaultValue) {
        ConfigValue value = entries.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.isEncrypted() ? cipher.decrypt(value.text()) : value.text();
    }

    public String get(String key) {
        return get(key, null);
    }

    /**
     * Like {@link #get(String, String)} but never throws; a value that cannot
     * be decrypted, or whose key file is unreadable or corrupt, yields the default.
     */
    public String getString(String key, String defaultValue) {
        try {
            return get(key, defaultValue);
        } catch (DecryptionException | KeyCorruptException | KeyFileAccessException e) {
            log.warn("Config entry '{}' could not be decrypted, using default: {}", key, e.getMessage());
            return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        ConfigValue value = entries.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!value.isEncrypted()) {
            return value.asInt().orElse(defaultValue);
        }
        return ConfigValue.parseInt(getString(key, null)).orElse(defaultValue);
    }

    public boolean getBool(String key, boolean defaultValue) {
        ConfigValue value = entries.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!value.isEncrypted()) {
            return value.asBool().orElse(defaultValue);
        }
        return ConfigValue.parseBool(getString(key, null)).orElse(defaultValue);
    }

    /**
     * Raw stored entry, without decryption.
     */
    public Optional<ConfigValue> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isEncrypted(String key) {
        ConfigValue value = entries.get(key);
        return value != null && value.isEncrypted();
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public Path getConfigPath() {
        return configPath;
    }

    // ========================================================================
    // PERSISTENCE
    // ========================================================================

    public LoadOutcome load() {
        return load(configPath);
    }

    /**
     * Read the file at {@code path} and merge its entries into this store.
     *
     * @return NOT_FOUND when the file does not exist (the store is unchanged)
     * @throws ConfigLoadException if the file cannot be read or is not a flat JSON object
     */
    public LoadOutcome load(Path path) {
        if (!Files.exists(path)) {
            log.info("No configuration file at {}, starting with current settings", path);
            return LoadOutcome.NOT_FOUND;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Malformed JSON in configuration file " + path, e);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration file " + path, e);
        }

        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Configuration file " + path + " must contain a JSON object");
        }

        Map<String, ConfigValue> loaded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ConfigValue value = fromJson(field.getKey(), field.getValue(), path);
            if (value != null) {
                loaded.put(field.getKey(), value);
            }
        }
        entries.putAll(loaded);

        log.info("Loaded {} configuration entries from {}", loaded.size(), path);
        if (!validate()) {
            log.warn("Configuration at {} is missing required settings or has an invalid port", path);
        }
        return LoadOutcome.LOADED;
    }

    public void save() {
        save(configPath);
    }

    /**
     * Write every entry to {@code path}, replacing the file.
     *
     * @throws ConfigSaveException on any I/O failure
     */
    public void save(Path path) {
        ObjectNode root = objectMapper.createObjectNode();
        entries.forEach((key, value) -> root.set(key, toJson(value)));

        try {
            Path directory = path.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Files.writeString(path, objectMapper.writeValueAsString(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigSaveException("Failed to save configuration file " + path, e);
        }

        log.info("Saved {} configuration entries to {}", entries.size(), path);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Check that host, port and username are present and non-blank and that
     * port is an integer between 1 and 65535.
     */
    public boolean validate() {
        for (String key : REQUIRED_KEYS) {
            String value = getString(key, null);
            if (value == null || value.isBlank()) {
                log.debug("Required configuration key '{}' is missing", key);
                return false;
            }
        }

        int port = getInt(KEY_PORT, -1);
        return port >= 1 && port <= 65535;
    }

    /**
     * Drop every entry from memory and release cached key material.
     */
    public void clearSensitiveData() {
        entries.clear();
        cipher.clearKey();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private JsonNode toJson(ConfigValue value) {
        return switch (value.type()) {
            case INT -> objectMapper.getNodeFactory().numberNode(Integer.parseInt(value.text()));
            case BOOL -> objectMapper.getNodeFactory().booleanNode(Boolean.parseBoolean(value.text()));
            case ENCRYPTED_STRING -> objectMapper.createObjectNode()
                    .put(ENCRYPTED_FLAG_FIELD, true)
                    .put(ENCRYPTED_VALUE_FIELD, value.text());
            case STRING -> objectMapper.getNodeFactory().textNode(value.text());
        };
    }

    private ConfigValue fromJson(String key, JsonNode node, Path path) {
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return ConfigValue.ofString(node.asText());
        }
        if (node.isBoolean()) {
            return ConfigValue.ofBool(node.booleanValue());
        }
        if (node.isInt()) {
            return ConfigValue.ofInt(node.intValue());
        }
        if (node.isNumber()) {
            return ConfigValue.ofString(node.asText());
        }
        if (node.isObject() && node.path(ENCRYPTED_FLAG_FIELD).asBoolean(false)
                && node.path(ENCRYPTED_VALUE_FIELD).isTextual()) {
            return ConfigValue.encrypted(node.get(ENCRYPTED_VALUE_FIELD).asText());
        }
        throw new ConfigLoadException("Unsupported value for key '" + key + "' in configuration file " + path);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Configuration key cannot be null or empty.");
        }
    }
}
