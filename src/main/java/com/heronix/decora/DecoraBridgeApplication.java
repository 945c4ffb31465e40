package com.heronix.decora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.decora.config.DecoraProperties;

/**
 * Heronix Decora Bridge - control processor integration for Leviton Decora devices.
 *
 * Credentials for the Decora cloud account are kept in a local JSON
 * configuration file with secrets encrypted under a per-installation key.
 * Every device call goes through a single cached bearer-token session.
 */
@SpringBootApplication
@EnableConfigurationProperties(DecoraProperties.class)
public class DecoraBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecoraBridgeApplication.class, args);
    }
}
