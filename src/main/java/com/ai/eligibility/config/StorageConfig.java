package com.ai.eligibility.config;

import com.ai.eligibility.component.PiiCipher;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;

/**
 * Encryption key for stored personal data: {@code storage.encryption.key} when set,
 * otherwise a key file that is created on first start.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Value("${storage.encryption.key:}")
    private String encryptionKey;

    @Value("${storage.encryption.key-file:data/encryption.key}")
    private String keyFile;

    @Bean
    public PiiCipher piiCipher() {
        if (StringUtils.isNotBlank(encryptionKey)) {
            return PiiCipher.fromBase64(encryptionKey);
        }
        return PiiCipher.fromBase64(loadOrCreateKey(Paths.get(keyFile)));
    }

    static String loadOrCreateKey(Path path) {
        try {
            if (Files.exists(path)) {
                return Files.readString(path, StandardCharsets.UTF_8).trim();
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String key = Base64.getEncoder().encodeToString(PiiCipher.generateKey());
            Files.writeString(path, key, StandardCharsets.UTF_8);
            log.info("Generated new encryption key at {}", path.toAbsolutePath());
            return key;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read or create encryption key file " + path, e);
        }
    }
}
