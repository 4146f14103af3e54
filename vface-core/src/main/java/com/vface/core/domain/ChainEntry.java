package com.vface.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

/**
 * Hash Chain Entry - one signed, linked anchor of a registration commitment.
 *
 * entryHash = SHA-256(index|commitment|fingerprint|timestamp|prevHash). Entries are written
 * once at the tail of the chain and never updated.
 */
@Entity
@Immutable
@Table(name = "hash_chain", indexes = {
    @Index(name = "idx_chain_fingerprint", columnList = "fingerprint")
})
public class ChainEntry implements Persistable<Long> {

    @Id
    @Column(name = "chain_index")
    private Long chainIndex;

    @NotNull
    @Column(name = "commitment", nullable = false, length = 64)
    private String commitment;

    @NotNull
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "entry_timestamp", nullable = false)
    private long timestamp;

    @NotNull
    @Column(name = "prev_hash", nullable = false, length = 64)
    private String prevHash;

    @NotNull
    @Column(name = "entry_hash", nullable = false, unique = true, length = 64)
    private String entryHash;

    @NotNull
    @Column(name = "signature", nullable = false, length = 512)
    private String signature;

    @Transient
    private boolean isNew;

    protected ChainEntry() {}

    public static ChainEntry create(long chainIndex, String commitment, String fingerprint,
                                    long timestamp, String prevHash, String entryHash, String signature) {
        if (chainIndex < 1) {
            throw new IllegalArgumentException("Chain index starts at 1");
        }
        ChainEntry entry = new ChainEntry();
        entry.chainIndex = chainIndex;
        entry.commitment = commitment;
        entry.fingerprint = fingerprint;
        entry.timestamp = timestamp;
        entry.prevHash = prevHash;
        entry.entryHash = entryHash;
        entry.signature = signature;
        entry.isNew = true;
        return entry;
    }

    /**
     * The string hashed into {@code entryHash}. Kept here so writers and verifiers
     * cannot disagree on field order.
     */
    public static String hashInput(long chainIndex, String commitment, String fingerprint,
                                   long timestamp, String prevHash) {
        return String.join("|",
                Long.toString(chainIndex),
                commitment,
                fingerprint,
                Long.toString(timestamp),
                prevHash);
    }

    public String hashInput() {
        return hashInput(chainIndex, commitment, fingerprint, timestamp, prevHash);
    }

    @Override
    public Long getId() {
        return chainIndex;
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

    // Getters
    public Long getChainIndex() { return chainIndex; }
    public String getCommitment() { return commitment; }
    public String getFingerprint() { return fingerprint; }
    public long getTimestamp() { return timestamp; }
    public String getPrevHash() { return prevHash; }
    public String getEntryHash() { return entryHash; }
    public String getSignature() { return signature; }
}
