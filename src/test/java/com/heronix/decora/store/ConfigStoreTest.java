package com.heronix.decora.store;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.decora.crypto.CredentialCipher;
import com.heronix.decora.crypto.SymmetricKeyStore;
import com.heronix.decora.exception.ConfigLoadException;
import com.heronix.decora.exception.DecryptionException;
import com.heronix.decora.exception.KeyCorruptException;

class ConfigStoreTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private CredentialCipher cipher;
    private ConfigStore store;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config").resolve("decora.json");
        cipher = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve("config").resolve(".key")));
        store = new ConfigStore(configPath, cipher);
    }

    @Test
    void encryptedPasswordSurvivesSaveAndLoad() throws Exception {
        store.set("password", "s3cret", true);
        store.save();

        JsonNode saved = new ObjectMapper().readTree(Files.readString(configPath));
        JsonNode password = saved.get("password");
        assertTrue(password.isObject());
        assertTrue(password.get("isEncrypted").asBoolean());
        assertNotEquals("s3cret", password.get("value").asText());
        assertFalse(Files.readString(configPath).contains("s3cret"));

        ConfigStore reloaded = new ConfigStore(configPath, cipher);
        assertEquals(LoadOutcome.LOADED, reloaded.load());
        assertEquals("s3cret", reloaded.get("password", null));
        assertTrue(reloaded.isEncrypted("password"));
    }

    @Test
    void saveAndLoadPreservesValuesAndTypes() {
        store.set("host", "bridge.local");
        store.setInt("port", 8443);
        store.setBool("use_ssl", true);
        store.set("api_key", "k-123", true);
        store.save();

        ConfigStore reloaded = new ConfigStore(configPath, cipher);
        reloaded.load();

        assertEquals(store.keys(), reloaded.keys());
        assertEquals(ConfigValue.ofString("bridge.local"), reloaded.entry("host").orElseThrow());
        assertEquals(ConfigValue.ofInt(8443), reloaded.entry("port").orElseThrow());
        assertEquals(ConfigValue.ofBool(true), reloaded.entry("use_ssl").orElseThrow());
        assertEquals("k-123", reloaded.get("api_key"));
        assertFalse(reloaded.isEncrypted("host"));
    }

    @Test
    void savedPlainEntriesAreBareScalars() throws Exception {
        store.set("host", "h");
        store.setInt("port", 80);
        store.setBool("use_ssl", false);
        store.save();

        JsonNode saved = new ObjectMapper().readTree(Files.readString(configPath));
        assertTrue(saved.get("host").isTextual());
        assertTrue(saved.get("port").isInt());
        assertTrue(saved.get("use_ssl").isBoolean());
    }

    @Test
    void missingFileIsNotAnError() {
        store.set("host", "kept");

        assertEquals(LoadOutcome.NOT_FOUND, store.load(tempDir.resolve("absent.json")));
        assertEquals("kept", store.get("host"));
    }

    @Test
    void malformedJsonFailsToLoad() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{ \"host\": ", StandardCharsets.UTF_8);

        assertThrows(ConfigLoadException.class, store::load);
    }

    @Test
    void nonObjectRootFailsToLoad() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "[1, 2, 3]", StandardCharsets.UTF_8);

        assertThrows(ConfigLoadException.class, store::load);
    }

    @Test
    void loadMergesOverExistingEntries() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"host\": \"from-file\", \"port\": 9000}", StandardCharsets.UTF_8);
        store.set("host", "in-memory");
        store.set("username", "alice");

        store.load();

        assertEquals("from-file", store.get("host"));
        assertEquals(9000, store.getInt("port", 0));
        assertEquals("alice", store.get("username"));
    }

    @Test
    void validateRequiresHostPortAndUsername() {
        assertFalse(store.validate());

        store.set("host", "bridge.local");
        store.setInt("port", 8080);
        assertFalse(store.validate());

        store.set("username", "alice");
        assertTrue(store.validate());
    }

    @Test
    void validateRejectsBlankValuesAndPortsOutOfRange() {
        store.set("host", "bridge.local");
        store.set("username", "alice");

        store.setInt("port", 0);
        assertFalse(store.validate());
        store.setInt("port", 65536);
        assertFalse(store.validate());
        store.setInt("port", 65535);
        assertTrue(store.validate());
        store.set("port", "not-a-port");
        assertFalse(store.validate());

        store.setInt("port", 1);
        store.set("host", "   ");
        assertFalse(store.validate());
    }

    @Test
    void typedGettersFallBackToDefaults() {
        store.set("port", "eighty");
        store.set("use_ssl", "maybe");
        store.set("timeout", " 250 ");

        assertEquals(8080, store.getInt("port", 8080));
        assertTrue(store.getBool("use_ssl", true));
        assertEquals(250, store.getInt("timeout", 0));
        assertEquals(7, store.getInt("absent", 7));
        assertEquals("fallback", store.getString("absent", "fallback"));
    }

    @Test
    void undecryptableEntryFallsBackInTypedGetters() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"password\": {\"isEncrypted\": true, \"value\": \"###\"}}",
                StandardCharsets.UTF_8);
        store.load();

        assertEquals("default", store.getString("password", "default"));
        assertThrows(DecryptionException.class, () -> store.get("password"));
    }

    @Test
    void corruptKeyFileFallsBackInTypedGettersAndValidate() throws Exception {
        Files.createDirectories(configPath.getParent());
        String blob = cipher.encrypt("8443");
        Files.write(tempDir.resolve("config").resolve(".key"), new byte[10]);
        Files.writeString(configPath, "{\"host\": \"h\", \"username\": \"u\", "
                + "\"port\": {\"isEncrypted\": true, \"value\": \"" + blob + "\"}, "
                + "\"use_ssl\": {\"isEncrypted\": true, \"value\": \"" + blob + "\"}}",
                StandardCharsets.UTF_8);

        CredentialCipher corrupt = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve("config").resolve(".key")));
        ConfigStore reloaded = new ConfigStore(configPath, corrupt);

        assertEquals(LoadOutcome.LOADED, reloaded.load());
        assertEquals(8080, reloaded.getInt("port", 8080));
        assertTrue(reloaded.getBool("use_ssl", true));
        assertEquals("fallback", reloaded.getString("port", "fallback"));
        assertFalse(reloaded.validate());
        assertThrows(KeyCorruptException.class, () -> reloaded.get("port"));
    }

    @Test
    void emptyEncryptedValueStaysEmpty() {
        store.set("api_key", "", true);

        assertTrue(store.isEncrypted("api_key"));
        assertEquals("", store.get("api_key"));
    }

    @Test
    void blankKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.set(" ", "value", false));
        assertThrows(IllegalArgumentException.class, () -> store.set("host", null, false));
    }

    @Test
    void clearSensitiveDataEmptiesTheStore() {
        store.set("password", "s3cret", true);

        store.clearSensitiveData();

        assertTrue(store.keys().isEmpty());
        assertFalse(store.contains("password"));
    }

    @Test
    void saveOverwritesWholeFile() throws Exception {
        store.set("host", "a");
        store.set("username", "alice");
        store.save();

        store.remove("username");
        store.save();

        JsonNode saved = new ObjectMapper().readTree(Files.readString(configPath));
        assertFalse(saved.has("username"));
        assertEquals("a", saved.get("host").asText());
    }
}
