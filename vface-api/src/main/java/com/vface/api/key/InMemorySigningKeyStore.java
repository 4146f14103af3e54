package com.vface.api.key;

import java.security.KeyPair;
import java.time.Instant;

/**
 * Non-persistent key store for tests and throwaway environments.
 */
public class InMemorySigningKeyStore implements SigningKeyStore {

    private KeyPair keyPair;
    private Instant createdAt;

    @Override
    public synchronized void storeSigningKeyPair(KeyPair keyPair, Instant createdAt) {
        this.keyPair = keyPair;
        this.createdAt = createdAt;
    }

    @Override
    public synchronized KeyPair loadSigningKeyPair() {
        return keyPair;
    }

    @Override
    public synchronized Instant getSigningKeyCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean isPersistent() {
        return false;
    }

    @Override
    public synchronized void wipe() {
        keyPair = null;
        createdAt = null;
    }
}
