package com.heronix.decora.store;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.heronix.decora.crypto.CredentialCipher;
import com.heronix.decora.crypto.SymmetricKeyStore;

class ConnectionSettingsTest {

    @TempDir
    Path tempDir;

    private ConfigStore store;
    private ConnectionSettings settings;

    @BeforeEach
    void setUp() {
        CredentialCipher cipher = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve(".key")));
        store = new ConfigStore(tempDir.resolve("decora.json"), cipher);
        settings = new ConnectionSettings(store);
    }

    @Test
    void defaultsApplyWhenUnset() {
        assertNull(settings.getHost());
        assertEquals(ConnectionSettings.DEFAULT_PORT, settings.getPort());
        assertEquals(ConnectionSettings.DEFAULT_CONNECTION_TIMEOUT_MS, settings.getConnectionTimeout());
        assertFalse(settings.isUseSsl());
        assertNull(settings.getPassword());
        assertFalse(settings.hasCredentials());
    }

    @Test
    void updateCredentialsEncryptsPasswordOnly() {
        settings.updateCredentials("alice", "s3cret");

        assertTrue(settings.hasCredentials());
        assertEquals("alice", settings.getUsername());
        assertEquals("s3cret", settings.getPassword());
        assertTrue(store.isEncrypted(ConnectionSettings.KEY_PASSWORD));
        assertFalse(store.isEncrypted(ConfigStore.KEY_USERNAME));
    }

    @Test
    void readsTypedValues() {
        store.set(ConfigStore.KEY_HOST, "bridge.local");
        store.setInt(ConfigStore.KEY_PORT, 443);
        store.setBool(ConnectionSettings.KEY_USE_SSL, true);
        store.setInt(ConnectionSettings.KEY_CONNECTION_TIMEOUT, 1500);
        store.set(ConnectionSettings.KEY_API_KEY, "key-1", true);

        assertEquals("bridge.local", settings.getHost());
        assertEquals(443, settings.getPort());
        assertTrue(settings.isUseSsl());
        assertEquals(1500, settings.getConnectionTimeout());
        assertEquals("key-1", settings.getApiKey());
    }
}
