package com.vface.api.matching;

import com.vface.api.crypto.EncryptionService;
import com.vface.core.domain.IdentityRecord;
import com.vface.core.repository.IdentityRecordRepository;
import com.vface.core.vector.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link VectorIndex} that decrypts and compares every active stored vector on each query.
 *
 * The registry table is the index, so insert and remove have nothing to maintain.
 * The scan reads without row locks and does not block concurrent registrations.
 * Rows that fail to decrypt or have the wrong dimension are skipped and logged.
 */
@Component
public class LinearScanVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(LinearScanVectorIndex.class);

    private final IdentityRecordRepository identityRepository;
    private final EncryptionService encryptionService;

    public LinearScanVectorIndex(IdentityRecordRepository identityRepository, EncryptionService encryptionService) {
        this.identityRepository = identityRepository;
        this.encryptionService = encryptionService;
    }

    @Override
    public void insert(String fingerprint, double[] vector) {
        log.debug("Vector for {} is served from the registry table", fingerprint.substring(0, 16));
    }

    @Override
    public void remove(String fingerprint) {
        log.debug("Revoked {} is excluded by the scan query", fingerprint.substring(0, 16));
    }

    @Override
    @Transactional(readOnly = true)
    public List<VectorMatch> query(double[] vector, double threshold, int topK) {
        List<VectorMatch> matches = new ArrayList<>();
        int skipped = 0;
        // Candidates arrive in insertion order; the stable sort below keeps it for ties
        for (IdentityRecord record : identityRepository.findActiveWithVector()) {
            double[] stored;
            try {
                stored = encryptionService.decryptVector(record.getEncryptedVector());
            } catch (EncryptionService.DecryptionException e) {
                log.warn("Skipping undecryptable vector for {}: {}",
                        record.getFingerprint().substring(0, 16), e.getMessage());
                skipped++;
                continue;
            }
            if (stored.length != vector.length) {
                log.warn("Skipping vector for {}: dimension {} does not match query dimension {}",
                        record.getFingerprint().substring(0, 16), stored.length, vector.length);
                skipped++;
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(vector, stored);
            if (similarity >= threshold) {
                matches.add(new VectorMatch(record.getFingerprint(), record.getOwnerKey(), similarity));
            }
        }
        if (skipped > 0) {
            log.warn("Similarity scan skipped {} corrupt rows", skipped);
        }

        matches.sort(Comparator.comparingDouble(VectorMatch::similarity).reversed());
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
    }
}
