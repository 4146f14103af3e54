package com.vface.sdk;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * SDK Data Models - DTOs for the V-Face Registry API.
 * Field names match the JSON bodies of {@code /api/v1}; unknown fields are ignored by the client.
 */
public final class SDKModels {

    private SDKModels() {} // Utility class

    // ==================== Registry ====================

    public record RegistrationResult(
        boolean success,
        long id,
        String fingerprint,
        String commitment,
        Long chainIndex,
        String entryHash,
        String chainSignature
    ) {}

    public record IdentityStatus(
        boolean exists,
        String fingerprint,
        boolean revoked,
        Instant revokedAt,
        String ownerKey,
        Instant createdAt,
        boolean hasVector,
        double[] vector,
        String commitment,
        Integer keyVersion,
        Long chainIndex,
        String chainSignature,
        Map<String, Object> metadata
    ) {}

    /**
     * The message an owner signs to revoke an identity. Serialized with keys in this order.
     */
    @JsonPropertyOrder({"action", "fingerprint", "timestamp", "nonce"})
    public record RevocationMessage(String action, String fingerprint, long timestamp, String nonce) {}

    public record SignedRevocation(RevocationMessage message, String signature) {}

    public record RevocationResult(boolean success, String fingerprint, Instant revokedAt) {}

    public record OwnerFingerprints(String ownerKey, List<String> fingerprints) {}

    public record Match(String fingerprint, String ownerKey, double similarity) {}

    public record SearchResult(List<Match> matches, double threshold) {}

    public record FingerprintResult(String fingerprint) {}

    // ==================== Consent ====================

    public record ConsentRequestResult(
        String status,
        UUID requestId,
        String fingerprint,
        String companyId,
        List<String> scope,
        long durationSeconds,
        Instant createdAt
    ) {}

    public record ConsentApproval(boolean success, String token, String tokenId, UUID consentId, Instant issuedAt, Instant expiresAt) {}

    public record ConsentClaims(
        String issuer,
        String subject,
        List<String> audience,
        String fingerprint,
        List<String> scope,
        String modelVersion,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
    ) {}

    public record TokenVerification(boolean valid, String reason, ConsentClaims claims) {}

    public record ActiveConsent(
        UUID consentId,
        String tokenId,
        UUID requestId,
        String companyId,
        List<String> scope,
        Instant issuedAt,
        Instant expiresAt
    ) {}

    public record PendingConsent(UUID requestId, String companyId, List<String> scope, long durationSeconds,
                                 Instant createdAt) {}

    // ==================== Hash Chain ====================

    public record ChainRoot(String root, long index, Instant timestamp, long totalEntries, String genesis) {}

    public record ChainEntry(
        long index,
        String commitment,
        String fingerprint,
        long timestamp,
        String prevHash,
        String entryHash,
        String signature
    ) {}

    public record ChainEntryWithKey(ChainEntry entry, String publicKey, String keyId) {}

    public record ChainVerification(boolean valid, long checked, String error, Long brokenAt, Instant verifiedAt) {}

    public record ChainSnapshot(
        String genesis,
        List<ChainEntry> entries,
        String root,
        long totalEntries,
        Instant exportedAt,
        String publicKey,
        String keyId
    ) {}

    // ==================== Admin ====================

    public record RotationReport(int rotated, int skipped, int errors, boolean dryRun, int targetVersion) {}

    // ==================== Errors ====================

    public record ErrorBody(String code, String kind, String message, boolean retryable, Map<String, Object> details) {}
}
