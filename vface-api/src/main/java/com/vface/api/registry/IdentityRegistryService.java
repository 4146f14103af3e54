package com.vface.api.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.api.chain.HashChainService;
import com.vface.api.crypto.EncryptionService;
import com.vface.api.key.KeyManagementService;
import com.vface.api.key.PemKeys;
import com.vface.api.matching.SimilarityMatcher;
import com.vface.api.matching.VectorIndex;
import com.vface.api.matching.VectorMatch;
import com.vface.api.replay.ReplayProtectionService;
import com.vface.core.crypto.Hashing;
import com.vface.core.domain.ChainEntry;
import com.vface.core.domain.IdentityRecord;
import com.vface.core.error.AuthorizationException;
import com.vface.core.error.ConflictException;
import com.vface.core.error.NotFoundException;
import com.vface.core.error.ValidationException;
import com.vface.core.fingerprint.FingerprintDeriver;
import com.vface.core.repository.IdentityRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry Store - enrolls, looks up and revokes identities.
 *
 * Registration with a vector runs the Sybil check, seals the vector, stores the record and anchors
 * its commitment in the hash chain, all in one transaction. The chain append lock is taken before
 * the Sybil check so two near-identical enrollments cannot both pass it.
 */
@Service
public class IdentityRegistryService {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistryService.class);

    static final int MAX_OWNER_KEY_LENGTH = 4096;
    static final int MAX_METADATA_LENGTH = 16384;
    private static final int COMMITMENT_NONCE_BYTES = 32;

    private final IdentityRecordRepository identityRepository;
    private final FingerprintDeriver fingerprintDeriver;
    private final EncryptionService encryptionService;
    private final SimilarityMatcher similarityMatcher;
    private final VectorIndex vectorIndex;
    private final HashChainService hashChainService;
    private final ReplayProtectionService replayProtectionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdentityRegistryService(
            IdentityRecordRepository identityRepository,
            FingerprintDeriver fingerprintDeriver,
            EncryptionService encryptionService,
            SimilarityMatcher similarityMatcher,
            VectorIndex vectorIndex,
            HashChainService hashChainService,
            ReplayProtectionService replayProtectionService,
            ObjectMapper objectMapper,
            Clock clock) {
        this.identityRepository = identityRepository;
        this.fingerprintDeriver = fingerprintDeriver;
        this.encryptionService = encryptionService;
        this.similarityMatcher = similarityMatcher;
        this.vectorIndex = vectorIndex;
        this.hashChainService = hashChainService;
        this.replayProtectionService = replayProtectionService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Registers a new identity.
     *
     * @throws AlreadyRegisteredException if the fingerprint is already enrolled
     * @throws DuplicateIdentityException if the vector is within the Sybil threshold of an enrolled one
     */
    @Transactional
    public RegistrationResult register(RegistrationRequest request) {
        validateRegistration(request);
        String fingerprint = request.fingerprint();

        if (identityRepository.existsByFingerprint(fingerprint)) {
            throw new AlreadyRegisteredException(fingerprint);
        }

        IdentityRecord record = IdentityRecord.create(fingerprint, request.ownerKey(), request.metadata(), clock.instant());
        double[] vector = request.vector();
        if (vector != null) {
            hashChainService.acquireAppendLock();
            Optional<VectorMatch> sybil = similarityMatcher.findSybilMatch(vector);
            if (sybil.isPresent()) {
                VectorMatch match = sybil.get();
                log.warn("Rejected registration of {}: vector matches {} with similarity {}",
                        prefix(fingerprint), prefix(match.fingerprint()), match.similarity());
                throw new DuplicateIdentityException(match.fingerprint(), match.similarity());
            }
            String payload = encryptionService.encryptVector(vector);
            String commitmentNonce = Hashing.randomHex(COMMITMENT_NONCE_BYTES);
            record.sealVector(payload, encryptionService.getCurrentVersion(),
                    commitmentOf(payload, commitmentNonce), commitmentNonce);
        }

        try {
            record = identityRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyRegisteredException(fingerprint);
        }

        ChainEntry entry = null;
        if (record.getCommitment() != null) {
            entry = hashChainService.append(record.getCommitment(), fingerprint);
            record.anchor(entry.getChainIndex(), entry.getSignature());
            vectorIndex.insert(fingerprint, vector);
        }

        log.info("Registered identity {} (id={}, anchored={})", prefix(fingerprint), record.getId(), entry != null);
        return new RegistrationResult(
                record.getId(),
                fingerprint,
                record.getCommitment(),
                record.getKeyVersion(),
                entry != null ? entry.getChainIndex() : null,
                entry != null ? entry.getEntryHash() : null,
                entry != null ? entry.getSignature() : null,
                record.getCreatedAt());
    }

    /**
     * Looks up a fingerprint. The decrypted vector is included only when {@code includeVector} is set.
     */
    @Transactional(readOnly = true)
    public CheckResult check(String fingerprint, boolean includeVector) {
        requireFingerprint(fingerprint);
        Optional<IdentityRecord> found = identityRepository.findByFingerprint(fingerprint);
        if (found.isEmpty()) {
            return CheckResult.absent(fingerprint);
        }
        IdentityRecord record = found.get();
        double[] vector = null;
        if (includeVector && record.hasVector()) {
            try {
                vector = encryptionService.decryptVector(record.getEncryptedVector());
            } catch (EncryptionService.DecryptionException e) {
                log.error("Stored vector for {} could not be decrypted: {}", prefix(fingerprint), e.getMessage());
            }
        }
        return new CheckResult(
                true,
                fingerprint,
                record.isRevoked(),
                record.getRevokedAt(),
                record.getOwnerKey(),
                record.getCreatedAt(),
                record.hasVector(),
                vector,
                record.getCommitment(),
                record.getKeyVersion(),
                record.getChainIndex(),
                record.getChainSignature(),
                record.getMetadata());
    }

    /**
     * Revokes an identity on presentation of an owner-signed revocation message.
     * The nonce is consumed and the flag flipped in one transaction under a row lock.
     */
    @Transactional
    public RevocationResult revoke(String fingerprint, String signature, RevocationMessage message) {
        requireFingerprint(fingerprint);
        if (signature == null || signature.isBlank()) {
            throw new InvalidRequestException("Signature is required");
        }
        if (message == null) {
            throw new InvalidRequestException("Revocation message is required");
        }
        message.requireWellFormed();
        if (!fingerprint.equals(message.fingerprint())) {
            throw new InvalidRequestException("Message fingerprint does not match the target fingerprint");
        }

        replayProtectionService.checkTimestamp(message.timestamp());
        replayProtectionService.requireUnused(message.nonce());

        IdentityRecord record = identityRepository.findByFingerprintForUpdate(fingerprint)
                .orElseThrow(() -> new IdentityNotFoundException(fingerprint));
        if (record.isRevoked()) {
            throw new AlreadyRevokedException(fingerprint);
        }

        PublicKey ownerKey;
        try {
            ownerKey = PemKeys.parsePublicKey(record.getOwnerKey());
        } catch (GeneralSecurityException e) {
            log.warn("Owner key of {} is not a usable public key: {}", prefix(fingerprint), e.getMessage());
            throw new NotOwnerException("Registered owner key cannot verify revocation signatures");
        }
        byte[] signed = message.canonicalJson().getBytes(StandardCharsets.UTF_8);
        if (!KeyManagementService.verifySignature(signed, signature, ownerKey)) {
            log.warn("Rejected revocation of {}: signature does not match owner", prefix(fingerprint));
            throw new NotOwnerException("Signature does not match the registered owner");
        }

        replayProtectionService.consume(message.nonce(), fingerprint, RevocationMessage.ACTION_REVOKE, message.timestamp());
        record.revoke(clock.instant());
        vectorIndex.remove(fingerprint);

        log.info("Revoked identity {}", prefix(fingerprint));
        return new RevocationResult(fingerprint, record.getRevokedAt());
    }

    @Transactional(readOnly = true)
    public List<String> listByOwner(String ownerKey) {
        if (ownerKey == null || ownerKey.isBlank()) {
            throw new InvalidRequestException("Owner key is required");
        }
        return identityRepository.findFingerprintsByOwnerKey(ownerKey);
    }

    public String deriveFingerprint(double[] vector) {
        return fingerprintDeriver.derive(vector);
    }

    public static String commitmentOf(String encryptedPayload, String commitmentNonce) {
        return Hashing.sha256Hex(encryptedPayload + commitmentNonce);
    }

    private void validateRegistration(RegistrationRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Registration request cannot be null");
        }
        requireFingerprint(request.fingerprint());
        if (request.ownerKey() == null || request.ownerKey().isBlank()) {
            throw new InvalidRequestException("Owner key is required");
        }
        if (request.ownerKey().length() > MAX_OWNER_KEY_LENGTH) {
            throw new InvalidRequestException("Owner key exceeds " + MAX_OWNER_KEY_LENGTH + " characters");
        }
        if (request.vector() != null) {
            fingerprintDeriver.requireDimension(request.vector());
        }
        if (request.metadata() != null) {
            try {
                if (objectMapper.writeValueAsString(request.metadata()).length() > MAX_METADATA_LENGTH) {
                    throw new InvalidRequestException("Metadata exceeds " + MAX_METADATA_LENGTH + " characters");
                }
            } catch (JsonProcessingException e) {
                throw new InvalidRequestException("Metadata must be JSON-serializable");
            }
        }
    }

    private static void requireFingerprint(String fingerprint) {
        if (!Hashing.isSha256Hex(fingerprint)) {
            throw new InvalidRequestException("Fingerprint must be 64 lowercase hex characters");
        }
    }

    private static String prefix(String fingerprint) {
        return fingerprint.substring(0, 16);
    }

    // Request/Result records
    public record RegistrationRequest(String fingerprint, String ownerKey, double[] vector, Map<String, Object> metadata) {}

    public record RegistrationResult(long id, String fingerprint, String commitment, Integer keyVersion,
                                     Long chainIndex, String entryHash, String chainSignature, Instant createdAt) {}

    public record CheckResult(boolean exists, String fingerprint, boolean revoked, Instant revokedAt, String ownerKey,
                              Instant createdAt, boolean hasVector, double[] vector, String commitment,
                              Integer keyVersion, Long chainIndex, String chainSignature, Map<String, Object> metadata) {
        static CheckResult absent(String fingerprint) {
            return new CheckResult(false, fingerprint, false, null, null, null, false, null,
                    null, null, null, null, new LinkedHashMap<>());
        }
    }

    public record RevocationResult(String fingerprint, Instant revokedAt) {}

    // Exceptions
    public static class InvalidRequestException extends ValidationException {
        public InvalidRequestException(String message) { super("REGISTRY_000", message); }
    }

    public static class AlreadyRegisteredException extends ConflictException {
        public AlreadyRegisteredException(String fingerprint) {
            super("REGISTRY_001", "Identity already registered: " + prefix(fingerprint));
        }
    }

    public static class DuplicateIdentityException extends ConflictException {
        private final String matchFingerprint;
        private final double similarity;

        public DuplicateIdentityException(String matchFingerprint, double similarity) {
            super("REGISTRY_002", String.format(Locale.ROOT,
                    "Duplicate identity: vector matches an enrolled identity (similarity %.4f)", similarity));
            this.matchFingerprint = matchFingerprint;
            this.similarity = similarity;
        }

        public String getMatchFingerprint() { return matchFingerprint; }
        public double getSimilarity() { return similarity; }

        @Override
        public Map<String, Object> getDetails() {
            return Map.of("matchFingerprint", matchFingerprint, "similarity", similarity);
        }
    }

    public static class IdentityNotFoundException extends NotFoundException {
        public IdentityNotFoundException(String fingerprint) {
            super("REGISTRY_003", "Identity not found: " + prefix(fingerprint));
        }
    }

    public static class AlreadyRevokedException extends ConflictException {
        public AlreadyRevokedException(String fingerprint) {
            super("REGISTRY_004", "Identity already revoked: " + prefix(fingerprint));
        }
    }

    public static class NotOwnerException extends AuthorizationException {
        public NotOwnerException(String message) { super("REGISTRY_005", message); }
    }
}
