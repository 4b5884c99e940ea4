package com.ai.eligibility.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("key file is generated once and reused")
    void generatesAndReusesKeyFile() throws Exception {
        Path keyFile = dir.resolve("keys/encryption.key");

        String first = StorageConfig.loadOrCreateKey(keyFile);
        String second = StorageConfig.loadOrCreateKey(keyFile);

        assertThat(Files.exists(keyFile)).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(Base64.getDecoder().decode(first)).hasSize(32);
    }
}
