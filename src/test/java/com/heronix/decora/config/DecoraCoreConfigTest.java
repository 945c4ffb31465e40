package com.heronix.decora.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class DecoraCoreConfigTest {

    @Test
    void keyFileSitsNextToConfigFile() {
        DecoraProperties.StorageConfig storage = new DecoraProperties.StorageConfig();
        storage.setConfigPath("/var/lib/decora/settings.json");

        Path keyFile = DecoraCoreConfig.keyFilePath(storage);

        assertEquals(Path.of("/var/lib/decora/.key").toAbsolutePath(), keyFile);
    }
}
