package com.vface.api.rotation;

import com.vface.api.crypto.EncryptionService;
import com.vface.api.registry.IdentityRegistryService;
import com.vface.core.domain.IdentityRecord;
import com.vface.core.error.IntegrityException;
import com.vface.core.repository.IdentityRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Re-encrypts every stored vector under the current encryption key version.
 *
 * A run is one transaction over all vector-bearing rows, locked for update. Records already at the
 * current version are skipped. Any failure aborts the run and rolls back every row, so the store is
 * never left partly migrated.
 */
@Service
public class KeyRotationService {

    private static final Logger log = LoggerFactory.getLogger(KeyRotationService.class);

    private final IdentityRecordRepository identityRepository;
    private final EncryptionService encryptionService;

    public KeyRotationService(IdentityRecordRepository identityRepository, EncryptionService encryptionService) {
        this.identityRepository = identityRepository;
        this.encryptionService = encryptionService;
    }

    /**
     * @param dryRun compute the report without persisting anything
     * @throws RotationFailedException if any record cannot be re-encrypted
     */
    @Transactional
    public RotationReport rotate(boolean dryRun) {
        int targetVersion = encryptionService.getCurrentVersion();
        List<IdentityRecord> records = identityRepository.findAllWithVectorForUpdate();
        log.info("Key rotation started: {} records with vectors, target v{}, dryRun={}",
                records.size(), targetVersion, dryRun);

        int rotated = 0;
        int skipped = 0;
        List<String> failures = new ArrayList<>();

        for (IdentityRecord record : records) {
            try {
                EncryptionService.ReEncryptionResult result = encryptionService.reEncrypt(record.getEncryptedVector());
                if (result.oldVersion() == result.newVersion()) {
                    skipped++;
                    continue;
                }
                String commitment = record.getCommitmentNonce() != null
                        ? IdentityRegistryService.commitmentOf(result.newPayload(), record.getCommitmentNonce())
                        : record.getCommitment();
                if (!dryRun) {
                    record.reseal(result.newPayload(), result.newVersion(), commitment);
                }
                rotated++;
            } catch (IntegrityException | IllegalStateException e) {
                log.error("Failed to rotate {}: {}", record.getFingerprint().substring(0, 16), e.getMessage());
                failures.add(record.getFingerprint());
            }
        }

        if (!failures.isEmpty()) {
            throw new RotationFailedException(failures, rotated, skipped);
        }

        log.info("Key rotation {}: rotated={}, skipped={}, target v{}",
                dryRun ? "dry run complete" : "complete", rotated, skipped, targetVersion);
        return new RotationReport(rotated, skipped, 0, dryRun, targetVersion);
    }

    public record RotationReport(int rotated, int skipped, int errors, boolean dryRun, int targetVersion) {}

    public static class RotationFailedException extends IntegrityException {
        private final List<String> failedFingerprints;
        private final int rotated;
        private final int skipped;

        public RotationFailedException(List<String> failedFingerprints, int rotated, int skipped) {
            super("ROTATION_001", "Key rotation aborted: " + failedFingerprints.size()
                    + " record(s) could not be re-encrypted; no changes were applied");
            this.failedFingerprints = List.copyOf(failedFingerprints);
            this.rotated = rotated;
            this.skipped = skipped;
        }

        public List<String> getFailedFingerprints() { return failedFingerprints; }
        public int getRotated() { return rotated; }
        public int getSkipped() { return skipped; }

        @Override
        public Map<String, Object> getDetails() {
            return Map.of("errors", failedFingerprints.size(), "rotated", rotated, "skipped", skipped);
        }
    }
}
