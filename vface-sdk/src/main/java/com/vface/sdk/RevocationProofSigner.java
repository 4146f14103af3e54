package com.vface.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.sdk.SDKModels.RevocationMessage;
import com.vface.sdk.SDKModels.SignedRevocation;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Builds owner-signed revocation proofs.
 *
 * The signature covers the compact JSON of the message with keys ordered
 * action, fingerprint, timestamp, nonce. EC keys sign with SHA256withECDSA, RSA keys with
 * SHA256withRSA; the signature is hex-encoded.
 */
public class RevocationProofSigner {

    public static final String ACTION_REVOKE = "revoke";
    private static final int NONCE_BYTES = 16;

    private final PrivateKey ownerKey;
    private final Clock clock;
    private final SecureRandom random;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RevocationProofSigner(PrivateKey ownerKey) {
        this(ownerKey, Clock.systemUTC(), new SecureRandom());
    }

    public RevocationProofSigner(PrivateKey ownerKey, Clock clock, SecureRandom random) {
        this.ownerKey = Objects.requireNonNull(ownerKey, "ownerKey");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a fresh revocation for {@code fingerprint}, stamped now with a random nonce.
     */
    public SignedRevocation createRevocation(String fingerprint) {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        RevocationMessage message = new RevocationMessage(ACTION_REVOKE, fingerprint,
                clock.instant().getEpochSecond(), HexFormat.of().formatHex(nonce));
        return new SignedRevocation(message, sign(message));
    }

    public String sign(RevocationMessage message) {
        try {
            Signature signature = Signature.getInstance(algorithmFor(ownerKey));
            signature.initSign(ownerKey);
            signature.update(canonicalJson(message).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign revocation message", e);
        }
    }

    public String canonicalJson(RevocationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Revocation message is not serializable", e);
        }
    }

    static String algorithmFor(Key key) {
        return switch (key.getAlgorithm()) {
            case "EC" -> "SHA256withECDSA";
            case "RSA" -> "SHA256withRSA";
            default -> throw new IllegalArgumentException("Unsupported owner key algorithm: " + key.getAlgorithm());
        };
    }
}
