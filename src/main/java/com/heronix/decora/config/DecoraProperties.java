package com.heronix.decora.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the Decora bridge.
 */
@Data
@ConfigurationProperties(prefix = "heronix.decora")
public class DecoraProperties {

    /**
     * Local configuration and key file storage
     */
    private StorageConfig storage = new StorageConfig();

    /**
     * Decora cloud API configuration
     */
    private ApiConfig api = new ApiConfig();

    /**
     * Session token configuration
     */
    private SessionConfig session = new SessionConfig();

    @Data
    public static class StorageConfig {
        /**
         * Path of the JSON configuration file
         */
        private String configPath = "./config/decora.json";

        /**
         * Name of the key file, created next to the configuration file
         */
        private String keyFileName = ".key";

        /**
         * Load the configuration file when the application starts
         */
        private boolean loadOnStartup = true;
    }

    @Data
    public static class ApiConfig {
        /**
         * Decora cloud API base URL
         */
        private String baseUrl = "https://api.leviton.com/api";

        /**
         * User-Agent sent with every device request
         */
        private String userAgent = "HeronixDecoraBridge/1.0";

        /**
         * Request deadline in seconds
         */
        private int timeoutSeconds = 30;
    }

    @Data
    public static class SessionConfig {
        /**
         * Seconds before expiry at which a token is reported as needing refresh
         */
        private long refreshThresholdSeconds = 300;

        /**
         * Token lifetime assumed when the login response omits expires_in
         */
        private long defaultExpiresInSeconds = 3600;
    }
}
