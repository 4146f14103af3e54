package com.vface.sdk;

import com.vface.sdk.SDKModels.ChainEntry;
import com.vface.sdk.SDKModels.ChainSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

/**
 * Offline verification of an exported chain snapshot.
 *
 * Rechecks every entry the way the registry does: entry hash, signature under the snapshot's
 * public key, linkage to the previous entry and the genesis link of entry 1. The snapshot root
 * must equal the last entry hash. Needs no connection to the registry.
 */
public class ChainSnapshotVerifier {

    public static final String GENESIS_SEED = "vface-genesis-v3";

    static final String HASH_MISMATCH = "Entry hash mismatch (data tampered)";
    static final String SIGNATURE_INVALID = "Signature verification failed";
    static final String LINKAGE_BROKEN = "Chain linkage broken (prev_hash mismatch)";
    static final String GENESIS_BROKEN = "Genesis link broken";
    static final String ROOT_MISMATCH = "Snapshot root does not match last entry";

    private final String expectedGenesis;

    public ChainSnapshotVerifier() {
        this(sha256Hex(GENESIS_SEED));
    }

    /**
     * @param expectedGenesis genesis hash to pin, or null to trust the one in the snapshot
     */
    public ChainSnapshotVerifier(String expectedGenesis) {
        this.expectedGenesis = expectedGenesis;
    }

    public Result verify(ChainSnapshot snapshot) {
        String genesis = expectedGenesis != null ? expectedGenesis : snapshot.genesis();
        if (expectedGenesis != null && !expectedGenesis.equals(snapshot.genesis())) {
            return Result.broken(0, GENESIS_BROKEN, null);
        }
        PublicKey publicKey;
        try {
            publicKey = parsePublicKey(snapshot.publicKey());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return Result.broken(0, "Snapshot public key is unreadable: " + e.getMessage(), null);
        }

        List<ChainEntry> entries = snapshot.entries() != null ? snapshot.entries() : List.of();
        String previousHash = null;
        for (int i = 0; i < entries.size(); i++) {
            ChainEntry entry = entries.get(i);
            long expectedIndex = i + 1L;
            if (entry.index() != expectedIndex) {
                return Result.broken(i, "Missing chain entry " + expectedIndex, expectedIndex);
            }
            if (!hashOf(entry).equals(entry.entryHash())) {
                return Result.broken(i + 1L, HASH_MISMATCH, entry.index());
            }
            if (!signatureValid(entry, publicKey)) {
                return Result.broken(i + 1L, SIGNATURE_INVALID, entry.index());
            }
            if (i > 0 && !entry.prevHash().equals(previousHash)) {
                return Result.broken(i + 1L, LINKAGE_BROKEN, entry.index());
            }
            if (i == 0 && !entry.prevHash().equals(genesis)) {
                return Result.broken(i + 1L, GENESIS_BROKEN, entry.index());
            }
            previousHash = entry.entryHash();
        }

        String expectedRoot = entries.isEmpty() ? genesis : previousHash;
        if (!expectedRoot.equals(snapshot.root())) {
            return Result.broken(entries.size(), ROOT_MISMATCH, null);
        }
        return new Result(true, entries.size(), null, null);
    }

    /**
     * SHA-256 over {@code index|commitment|fingerprint|timestamp|prevHash}, hex-encoded.
     */
    public static String hashOf(ChainEntry entry) {
        return sha256Hex(entry.index() + "|" + entry.commitment() + "|" + entry.fingerprint() + "|"
                + entry.timestamp() + "|" + entry.prevHash());
    }

    private static boolean signatureValid(ChainEntry entry, PublicKey publicKey) {
        if (entry.signature() == null) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(RevocationProofSigner.algorithmFor(publicKey));
            verifier.initVerify(publicKey);
            verifier.update(entry.entryHash().getBytes(StandardCharsets.UTF_8));
            return verifier.verify(HexFormat.of().parseHex(entry.signature()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            // malformed hex or DER counts as a failed signature
            return false;
        }
    }

    static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("no public key in snapshot");
        }
        String body = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
        X509EncodedKeySpec spec = new X509EncodedKeySpec(Base64.getDecoder().decode(body));
        try {
            return KeyFactory.getInstance("EC").generatePublic(spec);
        } catch (InvalidKeySpecException notEc) {
            return KeyFactory.getInstance("RSA").generatePublic(spec);
        }
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * @param checked entries inspected, counting the one that failed
     */
    public record Result(boolean valid, long checked, String error, Long brokenAt) {
        static Result broken(long checked, String error, Long brokenAt) {
            return new Result(false, checked, error, brokenAt);
        }
    }
}
