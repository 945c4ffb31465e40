package com.heronix.decora.store;

/**
 * Typed view of the Decora connection settings held in a {@link ConfigStore}.
 *
 * password and api_key are expected to be stored encrypted.
 */
public class ConnectionSettings {

    public static final String KEY_PASSWORD = "password";
    public static final String KEY_API_KEY = "api_key";
    public static final String KEY_CONNECTION_TIMEOUT = "connection_timeout";
    public static final String KEY_USE_SSL = "use_ssl";

    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5000;

    private final ConfigStore store;

    public ConnectionSettings(ConfigStore store) {
        this.store = store;
    }

    public String getHost() {
        return store.getString(ConfigStore.KEY_HOST, null);
    }

    public int getPort() {
        return store.getInt(ConfigStore.KEY_PORT, DEFAULT_PORT);
    }

    public String getUsername() {
        return store.getString(ConfigStore.KEY_USERNAME, null);
    }

    /**
     * Decrypted account password, or null if none is configured.
     */
    public String getPassword() {
        return store.get(KEY_PASSWORD);
    }

    /**
     * Decrypted API key, or null if none is configured.
     */
    public String getApiKey() {
        return store.get(KEY_API_KEY);
    }

    /**
     * Connection timeout in milliseconds.
     */
    public int getConnectionTimeout() {
        return store.getInt(KEY_CONNECTION_TIMEOUT, DEFAULT_CONNECTION_TIMEOUT_MS);
    }

    public boolean isUseSsl() {
        return store.getBool(KEY_USE_SSL, false);
    }

    /**
     * Store account credentials, encrypting the password.
     */
    public void updateCredentials(String username, String password) {
        store.set(ConfigStore.KEY_USERNAME, username, false);
        store.set(KEY_PASSWORD, password, true);
    }

    public boolean hasCredentials() {
        String username = getUsername();
        return username != null && !username.isBlank() && store.contains(KEY_PASSWORD);
    }
}
