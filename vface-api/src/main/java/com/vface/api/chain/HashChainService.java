package com.vface.api.chain;

import com.vface.api.key.KeyManagementService;
import com.vface.core.crypto.Hashing;
import com.vface.core.domain.ChainEntry;
import com.vface.core.domain.ChainHead;
import com.vface.core.error.IntegrityException;
import com.vface.core.error.NotFoundException;
import com.vface.core.error.ValidationException;
import com.vface.core.repository.ChainEntryRepository;
import com.vface.core.repository.ChainHeadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hash Chain Engine - append-only, signed, linked ledger of registration commitments.
 *
 * Every entry hashes its index, commitment, fingerprint, timestamp and the previous entry's hash,
 * and the entry hash is signed with the registry signing key. The first entry links to
 * SHA-256 of the genesis seed. Appends lock the chain head row, so index allocation and the
 * prevHash read are serialized until the appending transaction commits.
 */
@Service
public class HashChainService {

    private static final Logger log = LoggerFactory.getLogger(HashChainService.class);

    static final String HASH_MISMATCH = "Entry hash mismatch (data tampered)";
    static final String SIGNATURE_INVALID = "Signature verification failed";
    static final String LINKAGE_BROKEN = "Chain linkage broken (prev_hash mismatch)";
    static final String GENESIS_BROKEN = "Genesis link broken";

    private final ChainEntryRepository entryRepository;
    private final ChainHeadRepository headRepository;
    private final KeyManagementService keyManagementService;
    private final Clock clock;
    private final String genesisHash;

    public HashChainService(
            ChainEntryRepository entryRepository,
            ChainHeadRepository headRepository,
            KeyManagementService keyManagementService,
            Clock clock,
            @Value("${vface.chain.genesis-seed:vface-genesis-v3}") String genesisSeed) {
        this.entryRepository = entryRepository;
        this.headRepository = headRepository;
        this.keyManagementService = keyManagementService;
        this.clock = clock;
        this.genesisHash = Hashing.sha256Hex(genesisSeed);
    }

    /**
     * Appends a signed entry committing to {@code commitment} for {@code fingerprint}.
     * Joins the caller's transaction so the entry commits or rolls back with the registration.
     */
    @Transactional
    public ChainEntry append(String commitment, String fingerprint) {
        if (!Hashing.isSha256Hex(commitment)) {
            throw new ValidationException("CHAIN_001", "Commitment must be a 64-character hex digest");
        }
        if (!Hashing.isSha256Hex(fingerprint)) {
            throw new ValidationException("CHAIN_001", "Fingerprint must be a 64-character hex digest");
        }

        ChainHead head = lockHead();
        long index = head.nextIndex();
        String prevHash = head.isEmpty() ? genesisHash : head.getLastEntryHash();
        long timestamp = clock.millis();

        String entryHash = Hashing.sha256Hex(ChainEntry.hashInput(index, commitment, fingerprint, timestamp, prevHash));
        String signature = keyManagementService.signHex(entryHash);

        ChainEntry entry = entryRepository.save(
                ChainEntry.create(index, commitment, fingerprint, timestamp, prevHash, entryHash, signature));
        head.advance(index, entryHash);

        log.info("Chain entry {} appended for fingerprint {}", index, prefix(fingerprint));
        return entry;
    }

    /**
     * Takes the chain append lock inside the current transaction without appending.
     * Callers that must make a decision atomically with a later append take it first.
     */
    @Transactional
    public void acquireAppendLock() {
        lockHead();
    }

    @Transactional(readOnly = true)
    public ChainRoot getRoot() {
        Optional<ChainEntry> latest = entryRepository.findTopByOrderByChainIndexDesc();
        long total = entryRepository.count();
        return latest
                .map(e -> new ChainRoot(e.getEntryHash(), e.getChainIndex(), Instant.ofEpochMilli(e.getTimestamp()),
                        total, genesisHash))
                .orElseGet(() -> new ChainRoot(genesisHash, 0L, null, 0L, genesisHash));
    }

    @Transactional(readOnly = true)
    public ChainEntry getEntry(long index) {
        return entryRepository.findById(index)
                .orElseThrow(() -> new ChainEntryNotFoundException(index));
    }

    @Transactional(readOnly = true)
    public Optional<ChainEntry> findLatestByFingerprint(String fingerprint) {
        return entryRepository.findFirstByFingerprintOrderByChainIndexDesc(fingerprint);
    }

    /**
     * Verifies entries {@code from..to} inclusive; {@code to} is capped at the latest entry and
     * {@code null} means the latest entry.
     * Per entry the recomputed hash is checked first, then the signature, then linkage to the
     * previous entry (or to genesis when the range starts at 1). Stops at the first failure.
     */
    @Transactional(readOnly = true)
    public VerificationResult verifyChain(long from, Long to) {
        if (from < 1) {
            throw new ValidationException("CHAIN_002", "Verification range must start at 1 or later");
        }
        if (to != null && to < from) {
            throw new ValidationException("CHAIN_002", "Verification range end precedes its start");
        }
        long latest = entryRepository.findTopByOrderByChainIndexDesc().map(ChainEntry::getChainIndex).orElse(0L);
        long upper = to != null ? Math.min(to, latest) : latest;
        if (upper < from) {
            return VerificationResult.valid(0, clock.instant());
        }

        List<ChainEntry> entries = entryRepository.findByChainIndexBetweenOrderByChainIndexAsc(from, upper);
        String previousHash = null;
        long expectedIndex = from;
        long checked = 0;
        for (ChainEntry entry : entries) {
            long index = entry.getChainIndex();
            if (index != expectedIndex) {
                return failed(checked, "Missing chain entry " + expectedIndex, expectedIndex);
            }

            // the entry under inspection counts as checked, including when it fails
            checked++;
            String recomputed = Hashing.sha256Hex(entry.hashInput());
            if (!recomputed.equals(entry.getEntryHash())) {
                return failed(checked, HASH_MISMATCH, index);
            }
            if (!keyManagementService.verifyHex(entry.getEntryHash(), entry.getSignature())) {
                return failed(checked, SIGNATURE_INVALID, index);
            }
            if (previousHash != null && !entry.getPrevHash().equals(previousHash)) {
                return failed(checked, LINKAGE_BROKEN, index);
            }
            if (previousHash == null && from == 1 && !entry.getPrevHash().equals(genesisHash)) {
                return failed(checked, GENESIS_BROKEN, index);
            }

            previousHash = entry.getEntryHash();
            expectedIndex++;
        }
        if (expectedIndex <= upper) {
            return failed(checked, "Missing chain entry " + expectedIndex, expectedIndex);
        }
        return VerificationResult.valid(checked, clock.instant());
    }

    /**
     * Full ordered entry list plus the public key, for verification by third parties.
     */
    @Transactional(readOnly = true)
    public ChainSnapshot exportSnapshot() {
        List<ChainEntry> entries = entryRepository.findAllByOrderByChainIndexAsc();
        String root = entries.isEmpty() ? genesisHash : entries.get(entries.size() - 1).getEntryHash();
        return new ChainSnapshot(
                genesisHash,
                entries.stream().map(ChainEntryView::from).toList(),
                root,
                entries.size(),
                clock.instant(),
                keyManagementService.getPublicKeyPem(),
                keyManagementService.getKeyId());
    }

    public String getGenesisHash() {
        return genesisHash;
    }

    private ChainHead lockHead() {
        return headRepository.lockById(ChainHead.SINGLETON_ID)
                .orElseThrow(() -> new IntegrityException("CHAIN_003", "Chain head row is missing"));
    }

    private VerificationResult failed(long checked, String error, long brokenAt) {
        log.warn("Chain verification failed at entry {}: {}", brokenAt, error);
        return new VerificationResult(false, checked, error, brokenAt, clock.instant());
    }

    private static String prefix(String fingerprint) {
        return fingerprint.substring(0, 16);
    }

    // DTOs and Exceptions
    public record ChainRoot(String root, long index, Instant timestamp, long totalEntries, String genesis) {}

    public record VerificationResult(boolean valid, long checked, String error, Long brokenAt, Instant verifiedAt) {
        static VerificationResult valid(long checked, Instant verifiedAt) {
            return new VerificationResult(true, checked, null, null, verifiedAt);
        }
    }

    public record ChainEntryView(long index, String commitment, String fingerprint, long timestamp,
                                 String prevHash, String entryHash, String signature) {
        public static ChainEntryView from(ChainEntry entry) {
            return new ChainEntryView(entry.getChainIndex(), entry.getCommitment(), entry.getFingerprint(),
                    entry.getTimestamp(), entry.getPrevHash(), entry.getEntryHash(), entry.getSignature());
        }
    }

    public record ChainSnapshot(String genesis, List<ChainEntryView> entries, String root, long totalEntries,
                                Instant exportedAt, String publicKey, String keyId) {}

    public static class ChainEntryNotFoundException extends NotFoundException {
        public ChainEntryNotFoundException(long index) {
            super("CHAIN_004", "Chain entry " + index + " not found");
        }
    }
}
