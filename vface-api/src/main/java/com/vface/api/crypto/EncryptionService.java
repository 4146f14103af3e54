package com.vface.api.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.api.config.EncryptionConfig;
import com.vface.core.error.IntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encryption Service - versioned AES-256-GCM sealing of stored feature vectors.
 *
 * Payload format: {@code v{version}:{iv hex}:{tag hex}:{ciphertext hex}}. The version selects
 * the key at decryption time so several key generations can coexist during rotation.
 * Payloads written before versioning ({@code iv:tag:ciphertext}) decrypt as version 1.
 */
@Service
public class EncryptionService {

    private static final Logger log = LoggerFactory.getLogger(EncryptionService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_LENGTH / 8;
    private static final int AES_KEY_BYTES = 32;
    private static final int LEGACY_VERSION = 1;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<Integer, SecretKey> keyring;
    private final int currentVersion;
    private final ObjectMapper objectMapper;

    public EncryptionService(EncryptionConfig config, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.currentVersion = config.getCurrentVersion();
        this.keyring = Collections.unmodifiableMap(buildKeyring(config));
        if (!keyring.containsKey(currentVersion)) {
            throw new IllegalStateException(
                    "No encryption key configured for current version " + currentVersion);
        }
        log.info("Encryption keyring loaded: versions={}, current={}", keyring.keySet(), currentVersion);
    }

    /**
     * Encrypts under the current key version.
     */
    public String encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keyring.get(currentVersion), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // JCE appends the tag to the ciphertext
            int ctLength = sealed.length - GCM_TAG_BYTES;
            byte[] ciphertext = new byte[ctLength];
            byte[] tag = new byte[GCM_TAG_BYTES];
            System.arraycopy(sealed, 0, ciphertext, 0, ctLength);
            System.arraycopy(sealed, ctLength, tag, 0, GCM_TAG_BYTES);

            HexFormat hex = HexFormat.of();
            return "v" + currentVersion + ":" + hex.formatHex(iv) + ":" + hex.formatHex(tag) + ":" + hex.formatHex(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed", e);
        }
    }

    /**
     * Decrypts a payload with the key named by its embedded version.
     *
     * @throws DecryptionException on malformed payloads, unknown versions or tag mismatch
     */
    public byte[] decrypt(String payload) {
        SealedPayload sealed = parse(payload);
        SecretKey key = keyring.get(sealed.version());
        if (key == null) {
            throw new DecryptionException("Unknown key version " + sealed.version());
        }
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, sealed.iv()));
            byte[] combined = ByteBuffer.allocate(sealed.ciphertext().length + sealed.tag().length)
                    .put(sealed.ciphertext())
                    .put(sealed.tag())
                    .array();
            return cipher.doFinal(combined);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    /**
     * Decrypts under the payload's version and re-encrypts under the current version.
     */
    public ReEncryptionResult reEncrypt(String payload) {
        int oldVersion = versionOf(payload);
        byte[] plaintext = decrypt(payload);
        return new ReEncryptionResult(encrypt(plaintext), oldVersion, currentVersion);
    }

    public String encryptVector(double[] vector) {
        try {
            return encrypt(objectMapper.writeValueAsBytes(vector));
        } catch (IOException e) {
            throw new EncryptionException("Vector serialization failed", e);
        }
    }

    public double[] decryptVector(String payload) {
        byte[] plaintext = decrypt(payload);
        try {
            return objectMapper.readValue(plaintext, double[].class);
        } catch (IOException e) {
            throw new DecryptionException("Decrypted payload is not a vector", e);
        }
    }

    public int versionOf(String payload) {
        return parse(payload).version();
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public boolean hasKeyVersion(int version) {
        return keyring.containsKey(version);
    }

    private SealedPayload parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new DecryptionException("Payload is empty");
        }
        String[] parts = payload.split(":", -1);
        int offset;
        int version;
        if (parts.length == 4 && parts[0].startsWith("v")) {
            try {
                version = Integer.parseInt(parts[0].substring(1));
            } catch (NumberFormatException e) {
                throw new DecryptionException("Malformed version tag " + parts[0], e);
            }
            offset = 1;
        } else if (parts.length == 3) {
            version = LEGACY_VERSION;
            offset = 0;
        } else {
            throw new DecryptionException("Malformed payload: expected version, IV, tag and ciphertext");
        }
        try {
            HexFormat hex = HexFormat.of();
            byte[] iv = hex.parseHex(parts[offset]);
            byte[] tag = hex.parseHex(parts[offset + 1]);
            byte[] ciphertext = hex.parseHex(parts[offset + 2]);
            if (iv.length != GCM_IV_LENGTH || tag.length != GCM_TAG_BYTES) {
                throw new DecryptionException("Malformed payload: bad IV or tag length");
            }
            return new SealedPayload(version, iv, tag, ciphertext);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Malformed payload: invalid hex", e);
        }
    }

    private Map<Integer, SecretKey> buildKeyring(EncryptionConfig config) {
        Map<Integer, SecretKey> keys = new TreeMap<>();
        for (Map.Entry<Integer, String> entry : config.getKeys().entrySet()) {
            byte[] keyBytes;
            try {
                keyBytes = HexFormat.of().parseHex(entry.getValue().trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Encryption key v" + entry.getKey() + " is not valid hex", e);
            }
            if (keyBytes.length != AES_KEY_BYTES) {
                throw new IllegalStateException(
                        "Encryption key v" + entry.getKey() + " must be 32 bytes (64 hex characters)");
            }
            keys.put(entry.getKey(), new SecretKeySpec(keyBytes, "AES"));
        }
        if (keys.isEmpty()) {
            log.warn("No encryption keys configured; deriving a development key for version {}. "
                    + "Do not use this configuration in production.", config.getCurrentVersion());
            keys.put(config.getCurrentVersion(), deriveDevelopmentKey(config.getDevSeed()));
        }
        return keys;
    }

    private SecretKey deriveDevelopmentKey(String seed) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new SecretKeySpec(digest.digest(seed.getBytes(StandardCharsets.UTF_8)), "AES");
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to derive development key", e);
        }
    }

    private record SealedPayload(int version, byte[] iv, byte[] tag, byte[] ciphertext) {}

    // DTOs and Exceptions
    public record ReEncryptionResult(String newPayload, int oldVersion, int newVersion) {}

    public static class EncryptionException extends IntegrityException {
        public EncryptionException(String message, Throwable cause) { super("CRYPTO_001", message, cause); }
    }

    public static class DecryptionException extends IntegrityException {
        public DecryptionException(String message) { super("CRYPTO_002", message); }
        public DecryptionException(String message, Throwable cause) { super("CRYPTO_002", message, cause); }
    }
}
