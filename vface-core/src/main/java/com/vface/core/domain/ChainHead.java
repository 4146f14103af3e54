package com.vface.core.domain;

import jakarta.persistence.*;

/**
 * Single-row pointer to the tail of the hash chain.
 *
 * Appenders lock this row before reading the tail, which serializes index allocation
 * and prevHash reads across concurrent registrations.
 */
@Entity
@Table(name = "chain_head")
public class ChainHead {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Column(name = "last_index", nullable = false)
    private long lastIndex;

    @Column(name = "last_entry_hash", length = 64)
    private String lastEntryHash;

    protected ChainHead() {}

    public void advance(long index, String entryHash) {
        if (index != lastIndex + 1) {
            throw new IllegalStateException(
                    "Chain head at " + lastIndex + " cannot advance to " + index);
        }
        this.lastIndex = index;
        this.lastEntryHash = entryHash;
    }

    public long nextIndex() {
        return lastIndex + 1;
    }

    public boolean isEmpty() {
        return lastIndex == 0;
    }

    public Integer getId() { return id; }
    public long getLastIndex() { return lastIndex; }
    public String getLastEntryHash() { return lastEntryHash; }
}
