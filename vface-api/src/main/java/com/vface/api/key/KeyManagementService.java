package com.vface.api.key;

import com.vface.core.error.IntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Key Management Service for the registry signing keypair.
 *
 * Loads the EC P-256 keypair from its {@link SigningKeyStore}, generating and persisting one only when
 * the store is empty and generation is allowed. A restart never replaces an existing key.
 */
public class KeyManagementService {

    private static final Logger log = LoggerFactory.getLogger(KeyManagementService.class);
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    private final SigningKeyStore keyStore;
    private final boolean generateIfMissing;
    private final Clock clock;

    private KeyPair signingKeyPair;
    private Instant signingKeyCreatedAt;

    public KeyManagementService(SigningKeyStore keyStore, boolean generateIfMissing, Clock clock) {
        if (keyStore == null) {
            throw new IllegalArgumentException("KeyStore cannot be null");
        }
        this.keyStore = keyStore;
        this.generateIfMissing = generateIfMissing;
        this.clock = clock;
    }

    /**
     * Returns the signing keypair, loading it from the store on first use.
     *
     * @throws KeyManagementException if the store is empty and generation is disabled
     */
    public synchronized KeyPair getOrCreateSigningKeyPair() {
        if (signingKeyPair != null) {
            return signingKeyPair;
        }

        signingKeyPair = keyStore.loadSigningKeyPair();
        if (signingKeyPair != null) {
            signingKeyCreatedAt = keyStore.getSigningKeyCreatedAt();
            log.info("Loaded signing key {} created {}", getKeyId(), signingKeyCreatedAt);
            return signingKeyPair;
        }

        if (!generateIfMissing) {
            throw new KeyManagementException(
                    "No signing key found in key store and key generation is disabled");
        }

        KeyPair generated = generateECKeyPair();
        Instant createdAt = clock.instant();
        keyStore.storeSigningKeyPair(generated, createdAt);
        signingKeyPair = generated;
        signingKeyCreatedAt = createdAt;
        if (keyStore.isPersistent()) {
            log.info("Generated signing key {}", getKeyId());
        } else {
            log.warn("Generated signing key {} in a non-persistent key store; it will not survive a restart",
                    getKeyId());
        }
        return signingKeyPair;
    }

    public PublicKey getPublicKey() {
        return getOrCreateSigningKeyPair().getPublic();
    }

    public PrivateKey getPrivateKey() {
        return getOrCreateSigningKeyPair().getPrivate();
    }

    public String getPublicKeyPem() {
        return PemKeys.toPem(getPublicKey());
    }

    /**
     * Short identifier of the signing key: first 16 bytes of SHA-256 over the encoded public key, hex.
     */
    public String getKeyId() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(getOrCreateSigningKeyPair().getPublic().getEncoded());
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new KeyManagementException("Failed to compute key id", e);
        }
    }

    public synchronized Instant getSigningKeyCreatedAt() {
        getOrCreateSigningKeyPair();
        return signingKeyCreatedAt;
    }

    /**
     * Signs the UTF-8 bytes of {@code message} and returns the DER signature as hex.
     */
    public String signHex(String message) {
        if (message == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initSign(getPrivateKey());
            signature.update(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new KeyManagementException("Failed to sign data", e);
        }
    }

    /**
     * Verifies a hex signature made by this service's key. Malformed input verifies as false.
     */
    public boolean verifyHex(String message, String signatureHex) {
        return verifySignature(message.getBytes(StandardCharsets.UTF_8), signatureHex, getPublicKey());
    }

    /**
     * Verifies a hex signature against any EC or RSA public key. Malformed input verifies as false.
     */
    public static boolean verifySignature(byte[] data, String signatureHex, PublicKey publicKey) {
        if (data == null || signatureHex == null || publicKey == null) {
            throw new IllegalArgumentException("Data, signature, and public key cannot be null");
        }
        try {
            byte[] signatureBytes = HexFormat.of().parseHex(signatureHex);
            Signature signature = Signature.getInstance(PemKeys.signatureAlgorithmFor(publicKey));
            signature.initVerify(publicKey);
            signature.update(data);
            return signature.verify(signatureBytes);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature verification failed: {}", e.getMessage());
            return false;
        }
    }

    public SigningKeyStore getKeyStore() {
        return keyStore;
    }

    private KeyPair generateECKeyPair() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC");
            keyGen.initialize(new ECGenParameterSpec("secp256r1"), new SecureRandom());
            return keyGen.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new KeyManagementException("Failed to generate EC keypair", e);
        }
    }

    /**
     * Signing key unavailable or unusable. Reported as an integrity failure.
     */
    public static class KeyManagementException extends IntegrityException {
        public static final String CODE = "KEY_001";

        public KeyManagementException(String message) {
            super(CODE, message);
        }

        public KeyManagementException(String message, Throwable cause) {
            super(CODE, message, cause);
        }
    }
}
