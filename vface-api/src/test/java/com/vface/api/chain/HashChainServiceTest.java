package com.vface.api.chain;

import com.vface.api.key.KeyManagementService;
import com.vface.api.support.DatabaseCleaner;
import com.vface.core.crypto.Hashing;
import com.vface.core.domain.ChainEntry;
import com.vface.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the append-only signed hash chain: linkage, tamper detection and serialized appends.
 */
@SpringBootTest
@ActiveProfiles("test")
class HashChainServiceTest {

    @Autowired
    private HashChainService chainService;

    @Autowired
    private KeyManagementService keyManagementService;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbc);
    }

    @Test
    void emptyChainReportsGenesisAsRoot() {
        HashChainService.ChainRoot root = chainService.getRoot();

        assertThat(root.root()).isEqualTo(Hashing.sha256Hex("vface-genesis-v3"));
        assertThat(root.genesis()).isEqualTo(root.root());
        assertThat(root.index()).isZero();
        assertThat(root.totalEntries()).isZero();
        assertThat(chainService.verifyChain(1, null).valid()).isTrue();
    }

    @Test
    void appendedEntriesLinkToTheirPredecessor() {
        List<ChainEntry> entries = appendEntries(5);

        assertThat(entries).extracting(ChainEntry::getChainIndex).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(entries.get(0).getPrevHash()).isEqualTo(chainService.getGenesisHash());
        for (int i = 1; i < entries.size(); i++) {
            assertThat(entries.get(i).getPrevHash()).isEqualTo(entries.get(i - 1).getEntryHash());
        }
        for (ChainEntry entry : entries) {
            assertThat(entry.getEntryHash()).isEqualTo(Hashing.sha256Hex(entry.hashInput()));
            assertThat(keyManagementService.verifyHex(entry.getEntryHash(), entry.getSignature())).isTrue();
        }

        HashChainService.ChainRoot root = chainService.getRoot();
        assertThat(root.root()).isEqualTo(entries.get(4).getEntryHash());
        assertThat(root.index()).isEqualTo(5);
        assertThat(root.totalEntries()).isEqualTo(5);
    }

    @Test
    void untamperedChainVerifies() {
        appendEntries(6);

        HashChainService.VerificationResult full = chainService.verifyChain(1, null);
        HashChainService.VerificationResult partial = chainService.verifyChain(2, 4L);
        HashChainService.VerificationResult beyondTail = chainService.verifyChain(1, 100L);

        assertThat(full.valid()).isTrue();
        assertThat(full.checked()).isEqualTo(6);
        assertThat(partial.valid()).isTrue();
        assertThat(partial.checked()).isEqualTo(3);
        assertThat(beyondTail.valid()).isTrue();
        assertThat(beyondTail.checked()).isEqualTo(6);
    }

    @Test
    void tamperedCommitmentIsDetectedAtThatEntry() {
        appendEntries(5);
        jdbc.update("UPDATE hash_chain SET commitment = ? WHERE chain_index = 3", Hashing.randomHex(32));

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.checked()).isEqualTo(3);
        assertThat(result.error()).isEqualTo(HashChainService.HASH_MISMATCH);
    }

    @Test
    void tamperedFingerprintIsDetectedAtThatEntry() {
        appendEntries(5);
        jdbc.update("UPDATE hash_chain SET fingerprint = ? WHERE chain_index = 3", Hashing.randomHex(32));

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.checked()).isEqualTo(3);
        assertThat(result.error()).isEqualTo(HashChainService.HASH_MISMATCH);
    }

    @Test
    void tamperedTimestampIsDetectedAtThatEntry() {
        appendEntries(5);
        jdbc.update("UPDATE hash_chain SET entry_timestamp = entry_timestamp + 1 WHERE chain_index = 3");

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.checked()).isEqualTo(3);
        assertThat(result.error()).isEqualTo(HashChainService.HASH_MISMATCH);
    }

    @Test
    void replacedSignatureIsDetectedAtThatEntry() {
        appendEntries(5);
        // a well-formed signature by the chain key, but over different data
        String foreignSignature = keyManagementService.signHex(Hashing.randomHex(32));
        jdbc.update("UPDATE hash_chain SET signature = ? WHERE chain_index = 3", foreignSignature);

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.checked()).isEqualTo(3);
        assertThat(result.error()).isEqualTo(HashChainService.SIGNATURE_INVALID);
    }

    @Test
    void rehashedEntryWithoutNewSignatureFailsSignatureCheck() {
        List<ChainEntry> entries = appendEntries(4);
        ChainEntry target = entries.get(2);
        String forgedCommitment = Hashing.randomHex(32);
        String forgedHash = Hashing.sha256Hex(ChainEntry.hashInput(target.getChainIndex(), forgedCommitment,
                target.getFingerprint(), target.getTimestamp(), target.getPrevHash()));
        jdbc.update("UPDATE hash_chain SET commitment = ?, entry_hash = ? WHERE chain_index = 3",
                forgedCommitment, forgedHash);

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.error()).isEqualTo(HashChainService.SIGNATURE_INVALID);
    }

    @Test
    void resignedEntryStillBreaksLinkageToItsSuccessor() {
        List<ChainEntry> entries = appendEntries(4);
        ChainEntry target = entries.get(1);
        String forgedCommitment = Hashing.randomHex(32);
        String forgedHash = Hashing.sha256Hex(ChainEntry.hashInput(target.getChainIndex(), forgedCommitment,
                target.getFingerprint(), target.getTimestamp(), target.getPrevHash()));
        jdbc.update("UPDATE hash_chain SET commitment = ?, entry_hash = ?, signature = ? WHERE chain_index = 2",
                forgedCommitment, forgedHash, keyManagementService.signHex(forgedHash));

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.error()).isEqualTo(HashChainService.LINKAGE_BROKEN);
    }

    @Test
    void firstEntryMustLinkToGenesis() {
        List<ChainEntry> entries = appendEntries(2);
        ChainEntry first = entries.get(0);
        String forgedPrev = Hashing.sha256Hex("another-genesis");
        String forgedHash = Hashing.sha256Hex(ChainEntry.hashInput(1, first.getCommitment(),
                first.getFingerprint(), first.getTimestamp(), forgedPrev));
        jdbc.update("UPDATE hash_chain SET prev_hash = ?, entry_hash = ?, signature = ? WHERE chain_index = 1",
                forgedPrev, forgedHash, keyManagementService.signHex(forgedHash));

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.brokenAt()).isEqualTo(1L);
        assertThat(result.error()).isEqualTo(HashChainService.GENESIS_BROKEN);
        assertThat(result.checked()).isEqualTo(1);
        // A range that does not start at 1 does not check the genesis link
        assertThat(chainService.verifyChain(2, null).valid()).isTrue();
    }

    @Test
    void deletedEntryIsReportedAsMissing() {
        appendEntries(4);
        jdbc.update("DELETE FROM hash_chain WHERE chain_index = 3");

        HashChainService.VerificationResult result = chainService.verifyChain(1, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.brokenAt()).isEqualTo(3L);
        assertThat(result.error()).contains("Missing chain entry 3");
        assertThat(result.checked()).isEqualTo(2);
    }

    @Test
    void invalidRangesAreRejected() {
        assertThatThrownBy(() -> chainService.verifyChain(0, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> chainService.verifyChain(5, 2L)).isInstanceOf(ValidationException.class);
    }

    @Test
    void malformedCommitmentIsRejected() {
        assertThatThrownBy(() -> chainService.append("not-a-hash", Hashing.randomHex(32)))
                .isInstanceOf(ValidationException.class);
        assertThat(chainService.getRoot().totalEntries()).isZero();
    }

    @Test
    void missingEntryLookupThrowsNotFound() {
        assertThatThrownBy(() -> chainService.getEntry(42))
                .isInstanceOf(HashChainService.ChainEntryNotFoundException.class);
    }

    @Test
    void snapshotCarriesEntriesAndPublicKey() {
        List<ChainEntry> entries = appendEntries(3);

        HashChainService.ChainSnapshot snapshot = chainService.exportSnapshot();

        assertThat(snapshot.entries()).extracting(HashChainService.ChainEntryView::index).containsExactly(1L, 2L, 3L);
        assertThat(snapshot.root()).isEqualTo(entries.get(2).getEntryHash());
        assertThat(snapshot.genesis()).isEqualTo(chainService.getGenesisHash());
        assertThat(snapshot.totalEntries()).isEqualTo(3);
        assertThat(snapshot.publicKey()).isEqualTo(keyManagementService.getPublicKeyPem());
        assertThat(snapshot.keyId()).isEqualTo(keyManagementService.getKeyId());
    }

    @Test
    void concurrentAppendsGetDistinctConsecutiveIndices() throws Exception {
        int threads = 6;
        int perThread = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        Set<Long> indices = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                Callable<Void> task = () -> {
                    for (int i = 0; i < perThread; i++) {
                        indices.add(chainService.append(Hashing.randomHex(32), Hashing.randomHex(32)).getChainIndex());
                    }
                    return null;
                };
                futures.add(executor.submit(task));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(indices).hasSize(threads * perThread);
        assertThat(indices).allMatch(i -> i >= 1 && i <= threads * perThread);
        HashChainService.VerificationResult result = chainService.verifyChain(1, null);
        assertThat(result.valid()).isTrue();
        assertThat(result.checked()).isEqualTo(threads * perThread);
    }

    private List<ChainEntry> appendEntries(int count) {
        List<ChainEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(chainService.append(Hashing.randomHex(32), Hashing.randomHex(32)));
        }
        return entries;
    }
}
