package com.vface.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for vector encryption keys.
 *
 * Keys are 64-hex (AES-256) values keyed by integer version. New ciphertext always uses
 * {@code currentVersion}; older versions stay configured until a rotation run has
 * re-encrypted every record.
 */
@Configuration
@ConfigurationProperties(prefix = "vface.encryption")
public class EncryptionConfig {

    private int currentVersion = 1;
    private Map<Integer, String> keys = new HashMap<>();
    private String devSeed = "vface-dev-encryption-key";

    public int getCurrentVersion() { return currentVersion; }
    public void setCurrentVersion(int currentVersion) { this.currentVersion = currentVersion; }

    public Map<Integer, String> getKeys() { return keys; }
    public void setKeys(Map<Integer, String> keys) { this.keys = keys; }

    public String getDevSeed() { return devSeed; }
    public void setDevSeed(String devSeed) { this.devSeed = devSeed; }
}
