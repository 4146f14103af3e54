package com.vface.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity Record - a registered fingerprint, its controlling owner and the sealed feature vector.
 *
 * Records are never deleted. Revocation flips a flag and records a timestamp;
 * once revoked a record cannot be reinstated.
 */
@Entity
@Table(name = "identity_records", indexes = {
    @Index(name = "idx_identity_fingerprint", columnList = "fingerprint", unique = true),
    @Index(name = "idx_identity_revoked", columnList = "revoked")
})
public class IdentityRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "fingerprint", nullable = false, unique = true, updatable = false, length = 64)
    private String fingerprint;

    @NotNull
    @Column(name = "owner_key", nullable = false, updatable = false, length = 4096)
    private String ownerKey;

    @Column(name = "encrypted_vector", length = 65536)
    private String encryptedVector;

    @Column(name = "commitment", length = 64)
    private String commitment;

    @Column(name = "commitment_nonce", length = 64)
    private String commitmentNonce;

    @Column(name = "key_version")
    private Integer keyVersion;

    @Column(name = "chain_index")
    private Long chainIndex;

    @Column(name = "chain_signature", length = 512)
    private String chainSignature;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "revoked", nullable = false)
    private boolean revoked;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Convert(converter = MetadataConverter.class)
    @Column(name = "metadata", length = 16384)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Version
    private Long version;

    protected IdentityRecord() {}

    public static IdentityRecord create(String fingerprint, String ownerKey,
                                        Map<String, Object> metadata, Instant createdAt) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Fingerprint cannot be null or blank");
        }
        if (ownerKey == null || ownerKey.isBlank()) {
            throw new IllegalArgumentException("Owner key cannot be null or blank");
        }
        IdentityRecord record = new IdentityRecord();
        record.fingerprint = fingerprint;
        record.ownerKey = ownerKey;
        record.createdAt = createdAt;
        record.revoked = false;
        if (metadata != null) {
            record.metadata = new LinkedHashMap<>(metadata);
        }
        return record;
    }

    /**
     * Attaches the sealed vector together with the commitment derived from it.
     */
    public void sealVector(String encryptedVector, int keyVersion, String commitment, String commitmentNonce) {
        this.encryptedVector = encryptedVector;
        this.keyVersion = keyVersion;
        this.commitment = commitment;
        this.commitmentNonce = commitmentNonce;
    }

    /**
     * Replaces the sealed vector after re-encryption under a newer key.
     * The commitment nonce is kept so the new commitment stays reproducible.
     */
    public void reseal(String encryptedVector, int keyVersion, String commitment) {
        if (this.encryptedVector == null) {
            throw new IllegalStateException("Record " + fingerprint + " has no vector to reseal");
        }
        this.encryptedVector = encryptedVector;
        this.keyVersion = keyVersion;
        this.commitment = commitment;
    }

    public void anchor(long chainIndex, String chainSignature) {
        if (this.chainIndex != null) {
            throw new IllegalStateException("Record " + fingerprint + " is already anchored at " + this.chainIndex);
        }
        this.chainIndex = chainIndex;
        this.chainSignature = chainSignature;
    }

    public void revoke(Instant at) {
        if (revoked) {
            throw new IllegalStateException("Identity already revoked");
        }
        this.revoked = true;
        this.revokedAt = at;
    }

    public boolean hasVector() {
        return encryptedVector != null;
    }

    // Getters
    public Long getId() { return id; }
    public String getFingerprint() { return fingerprint; }
    public String getOwnerKey() { return ownerKey; }
    public String getEncryptedVector() { return encryptedVector; }
    public String getCommitment() { return commitment; }
    public String getCommitmentNonce() { return commitmentNonce; }
    public Integer getKeyVersion() { return keyVersion; }
    public Long getChainIndex() { return chainIndex; }
    public String getChainSignature() { return chainSignature; }
    public Instant getCreatedAt() { return createdAt; }
    public boolean isRevoked() { return revoked; }
    public Instant getRevokedAt() { return revokedAt; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Long getVersion() { return version; }
}
