package com.vface.api.config;

import com.vface.api.key.FileSystemSigningKeyStore;
import com.vface.api.key.InMemorySigningKeyStore;
import com.vface.api.key.KeyManagementService;
import com.vface.api.key.SigningKeyStore;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Configuration for the registry signing keypair.
 *
 * {@code store} selects {@code filesystem} (PEM files under {@code directory}) or {@code memory}.
 */
@Configuration
@ConfigurationProperties(prefix = "vface.keys")
public class SigningKeyConfig {

    private String store = "filesystem";
    private String directory = "./keys";
    private boolean generateIfMissing = true;

    @Bean
    public SigningKeyStore signingKeyStore() {
        return switch (store) {
            case "filesystem" -> new FileSystemSigningKeyStore(Path.of(directory));
            case "memory" -> new InMemorySigningKeyStore();
            default -> throw new IllegalStateException("Unknown key store type: " + store);
        };
    }

    @Bean
    public KeyManagementService keyManagementService(SigningKeyStore signingKeyStore, Clock clock) {
        KeyManagementService service = new KeyManagementService(signingKeyStore, generateIfMissing, clock);
        // Fail at startup rather than on the first registration
        service.getOrCreateSigningKeyPair();
        return service;
    }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }

    public boolean isGenerateIfMissing() { return generateIfMissing; }
    public void setGenerateIfMissing(boolean generateIfMissing) { this.generateIfMissing = generateIfMissing; }
}
