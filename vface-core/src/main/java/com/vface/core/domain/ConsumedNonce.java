package com.vface.core.domain;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Consumed Nonce - a proof-message nonce that has already been accepted.
 *
 * A nonce is written exactly once, in the same transaction as the action it authorized.
 * The primary key makes a second insert of the same value fail. Rows past their expiry
 * no longer protect anything (the timestamp window rejects the message first) and are
 * garbage collected.
 */
@Entity
@Table(name = "nonces", indexes = {
    @Index(name = "idx_nonce_expires_at", columnList = "expires_at")
})
public class ConsumedNonce implements Persistable<String> {

    public static final int MAX_LENGTH = 128;

    @Id
    @Column(name = "nonce", length = MAX_LENGTH)
    private String nonce;

    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "action", nullable = false, length = 32)
    private String action;

    @Column(name = "consumed_at", nullable = false)
    private Instant consumedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Transient
    private boolean isNew;

    protected ConsumedNonce() {}

    public static ConsumedNonce consume(String nonce, String fingerprint, String action,
                                        Instant consumedAt, Instant expiresAt) {
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("Nonce cannot be null or blank");
        }
        if (nonce.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Nonce exceeds " + MAX_LENGTH + " characters");
        }
        if (expiresAt == null || consumedAt == null) {
            throw new IllegalArgumentException("Consumption and expiration times are required");
        }
        if (expiresAt.isBefore(consumedAt)) {
            throw new IllegalArgumentException("Nonce cannot expire before it is consumed");
        }
        ConsumedNonce consumed = new ConsumedNonce();
        consumed.nonce = nonce;
        consumed.fingerprint = fingerprint;
        consumed.action = action;
        consumed.consumedAt = consumedAt;
        consumed.expiresAt = expiresAt;
        consumed.isNew = true;
        return consumed;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    @Override
    public String getId() {
        return nonce;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    public String getNonce() { return nonce; }
    public String getFingerprint() { return fingerprint; }
    public String getAction() { return action; }
    public Instant getConsumedAt() { return consumedAt; }
    public Instant getExpiresAt() { return expiresAt; }
}
