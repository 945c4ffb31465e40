package com.heronix.decora.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.decora.client.DecoraApiClient;
import com.heronix.decora.client.DecoraAuthClient;
import com.heronix.decora.crypto.CredentialCipher;
import com.heronix.decora.crypto.SymmetricKeyStore;
import com.heronix.decora.session.SessionTokenManager;
import com.heronix.decora.store.ConfigStore;
import com.heronix.decora.store.ConnectionSettings;

/**
 * Wires the credential and session core.
 *
 * The key file lives in the same directory as the configuration file. Each
 * HTTP client gets its own WebClient.Builder instance (the auto-configured
 * builder bean is prototype-scoped).
 */
@Configuration
public class DecoraCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SymmetricKeyStore symmetricKeyStore(DecoraProperties properties) {
        return new SymmetricKeyStore(keyFilePath(properties.getStorage()));
    }

    @Bean
    public CredentialCipher credentialCipher(SymmetricKeyStore keyStore) {
        return new CredentialCipher(keyStore);
    }

    @Bean
    public ConfigStore configStore(DecoraProperties properties, CredentialCipher cipher, ObjectMapper objectMapper) {
        return new ConfigStore(Paths.get(properties.getStorage().getConfigPath()), cipher, objectMapper);
    }

    @Bean
    public ConnectionSettings connectionSettings(ConfigStore configStore) {
        return new ConnectionSettings(configStore);
    }

    @Bean
    public DecoraAuthClient decoraAuthClient(ObjectProvider<WebClient.Builder> webClientBuilder,
                                             DecoraProperties properties) {
        return new DecoraAuthClient(webClientBuilder.getIfAvailable(WebClient::builder), properties);
    }

    @Bean
    public SessionTokenManager sessionTokenManager(DecoraAuthClient authClient, Clock clock,
                                                   DecoraProperties properties) {
        DecoraProperties.SessionConfig session = properties.getSession();
        return new SessionTokenManager(authClient, clock,
                Duration.ofSeconds(session.getRefreshThresholdSeconds()),
                session.getDefaultExpiresInSeconds());
    }

    @Bean
    public DecoraApiClient decoraApiClient(ObjectProvider<WebClient.Builder> webClientBuilder,
                                           DecoraProperties properties,
                                           SessionTokenManager sessionTokenManager) {
        return new DecoraApiClient(webClientBuilder.getIfAvailable(WebClient::builder), properties,
                sessionTokenManager);
    }

    static Path keyFilePath(DecoraProperties.StorageConfig storage) {
        Path directory = Paths.get(storage.getConfigPath()).toAbsolutePath().getParent();
        return directory.resolve(storage.getKeyFileName());
    }
}
