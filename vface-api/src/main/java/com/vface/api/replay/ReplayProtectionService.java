package com.vface.api.replay;

import com.vface.core.domain.ConsumedNonce;
import com.vface.core.error.ReplayException;
import com.vface.core.error.ValidationException;
import com.vface.core.repository.ConsumedNonceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Replay protection for signed proof messages.
 *
 * A message is fresh when its timestamp lies within the configured window of server time and its
 * nonce has never been consumed. Consumption happens inside the caller's transaction, so the nonce
 * and the action it authorizes commit together or not at all.
 */
@Service
public class ReplayProtectionService {

    private static final Logger log = LoggerFactory.getLogger(ReplayProtectionService.class);

    private final ConsumedNonceRepository nonceRepository;
    private final Clock clock;
    private final long windowSeconds;

    public ReplayProtectionService(
            ConsumedNonceRepository nonceRepository,
            Clock clock,
            @Value("${vface.replay.timestamp-window-seconds:300}") long windowSeconds) {
        this.nonceRepository = nonceRepository;
        this.clock = clock;
        this.windowSeconds = windowSeconds;
    }

    /**
     * Rejects message timestamps (epoch seconds) outside the window around server time.
     */
    public void checkTimestamp(long timestampSeconds) {
        long now = clock.instant().getEpochSecond();
        long skew = Math.abs(now - timestampSeconds);
        if (skew > windowSeconds) {
            log.warn("Rejected stale proof message: skew {}s exceeds {}s", skew, windowSeconds);
            throw new StaleTimestampException(
                    "Message timestamp is outside the " + windowSeconds + "s acceptance window");
        }
    }

    @Transactional(readOnly = true)
    public boolean isConsumed(String nonce) {
        return nonceRepository.existsById(nonce);
    }

    /**
     * Rejects a nonce that has already been consumed.
     */
    @Transactional(readOnly = true)
    public void requireUnused(String nonce) {
        requireWellFormed(nonce);
        if (nonceRepository.existsById(nonce)) {
            log.warn("Replay detected: nonce already consumed");
            throw new NonceReusedException("Nonce already used");
        }
    }

    /**
     * Records the nonce as consumed. Must run inside the transaction of the action it authorizes.
     * A concurrent consumer of the same nonce loses on the primary key.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ConsumedNonce consume(String nonce, String fingerprint, String action, long messageTimestampSeconds) {
        requireWellFormed(nonce);
        Instant now = clock.instant();
        Instant expiresAt = Instant.ofEpochSecond(Math.max(messageTimestampSeconds, now.getEpochSecond()))
                .plusSeconds(windowSeconds);
        try {
            return nonceRepository.saveAndFlush(ConsumedNonce.consume(nonce, fingerprint, action, now, expiresAt));
        } catch (DataIntegrityViolationException e) {
            log.warn("Replay detected: concurrent use of the same nonce");
            throw new NonceReusedException("Nonce already used", e);
        }
    }

    /**
     * Deletes nonces whose window has closed. A replayed message carrying a purged nonce
     * is still rejected by the timestamp check.
     */
    @Scheduled(fixedRateString = "${vface.replay.cleanup-interval-ms:600000}")
    @Transactional
    public int purgeExpired() {
        int deleted = nonceRepository.deleteExpired(clock.instant());
        if (deleted > 0) {
            log.info("Purged {} expired nonces", deleted);
        }
        return deleted;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    private void requireWellFormed(String nonce) {
        if (nonce == null || nonce.isBlank()) {
            throw new ValidationException("REPLAY_003", "Nonce cannot be null or blank");
        }
        if (nonce.length() > ConsumedNonce.MAX_LENGTH) {
            throw new ValidationException("REPLAY_003", "Nonce exceeds " + ConsumedNonce.MAX_LENGTH + " characters");
        }
    }

    // Exceptions
    public static class StaleTimestampException extends ReplayException {
        public StaleTimestampException(String message) { super("REPLAY_001", message); }
    }

    public static class NonceReusedException extends ReplayException {
        public NonceReusedException(String message) { super("REPLAY_002", message); }
        public NonceReusedException(String message, Throwable cause) { super("REPLAY_002", message, cause); }
    }
}
