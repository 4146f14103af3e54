package com.vface.api.key;

import java.security.KeyPair;
import java.time.Instant;

/**
 * Storage for the registry's signing keypair, which signs chain entries and consent tokens.
 *
 * The keypair must survive restarts: a store that loses it forces a new key and breaks
 * verification of everything signed before.
 */
public interface SigningKeyStore {

    /**
     * Persists the signing keypair.
     *
     * @param keyPair   The keypair to store
     * @param createdAt When the keypair was created
     */
    void storeSigningKeyPair(KeyPair keyPair, Instant createdAt);

    /**
     * Loads the signing keypair.
     *
     * @return The keypair, or null if none has been stored
     */
    KeyPair loadSigningKeyPair();

    /**
     * @return Creation time of the stored keypair, or null if none has been stored
     */
    Instant getSigningKeyCreatedAt();

    /**
     * @return true if stored keys outlive the process
     */
    boolean isPersistent();

    /**
     * Deletes the stored keypair.
     */
    void wipe();
}
