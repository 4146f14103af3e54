package com.vface.api.registry;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.core.error.ValidationException;

/**
 * Ownership-proof message for revocation.
 *
 * The owner signs {@link #canonicalJson()}: compact JSON with keys in the order
 * action, fingerprint, timestamp (epoch seconds), nonce.
 */
@JsonPropertyOrder({"action", "fingerprint", "timestamp", "nonce"})
public record RevocationMessage(String action, String fingerprint, Long timestamp, String nonce) {

    public static final String ACTION_REVOKE = "revoke";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    public static RevocationMessage revoke(String fingerprint, long timestampSeconds, String nonce) {
        return new RevocationMessage(ACTION_REVOKE, fingerprint, timestampSeconds, nonce);
    }

    /**
     * Structural check performed before any signature work.
     */
    public void requireWellFormed() {
        if (!ACTION_REVOKE.equals(action)) {
            throw new ValidationException("REVOKE_001", "Message action must be '" + ACTION_REVOKE + "'");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new ValidationException("REVOKE_001", "Message fingerprint is required");
        }
        if (timestamp == null) {
            throw new ValidationException("REVOKE_001", "Message timestamp is required");
        }
        if (nonce == null || nonce.isBlank()) {
            throw new ValidationException("REVOKE_001", "Message nonce is required");
        }
    }

    public String canonicalJson() {
        try {
            return CANONICAL_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Revocation message is not serializable", e);
        }
    }
}
