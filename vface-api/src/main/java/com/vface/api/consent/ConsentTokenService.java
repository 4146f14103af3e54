package com.vface.api.consent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vface.api.key.KeyManagementService;
import com.vface.core.crypto.Hashing;
import com.vface.core.domain.ActiveConsent;
import com.vface.core.domain.IdentityRecord;
import com.vface.core.domain.PendingConsentRequest;
import com.vface.core.error.AuthorizationException;
import com.vface.core.error.ConflictException;
import com.vface.core.error.NotFoundException;
import com.vface.core.error.ValidationException;
import com.vface.core.repository.ActiveConsentRepository;
import com.vface.core.repository.IdentityRecordRepository;
import com.vface.core.repository.PendingConsentRequestRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MissingClaimException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Consent Token Service - request, approve and verify consent tokens bound to a fingerprint.
 *
 * Tokens are ES256 JWTs signed with the registry signing key. Verification always consults the
 * live registry: a revoked identity invalidates every outstanding token, and a registry that cannot
 * be read yields {@code registry_unavailable}, never a valid result.
 */
@Service
public class ConsentTokenService {

    private static final Logger log = LoggerFactory.getLogger(ConsentTokenService.class);

    public static final String STATUS_PENDING_APPROVAL = "pending_user_approval";
    static final String CLAIM_FINGERPRINT = "vf_fp";
    static final String CLAIM_SCOPE = "vf_scope";
    static final String CLAIM_MODEL_VERSION = "vf_model_v";

    static final int MAX_COMPANY_ID_LENGTH = 256;
    static final int MAX_SCOPE_ENTRIES = 32;
    static final int MAX_SCOPE_ENTRY_LENGTH = 128;

    private final IdentityRecordRepository identityRepository;
    private final PendingConsentRequestRepository pendingRepository;
    private final ActiveConsentRepository activeConsentRepository;
    private final KeyManagementService keyManagementService;
    private final Clock clock;
    private final String issuer;
    private final String modelVersion;
    private final long minDurationSeconds;
    private final long maxDurationSeconds;

    public ConsentTokenService(
            IdentityRecordRepository identityRepository,
            PendingConsentRequestRepository pendingRepository,
            ActiveConsentRepository activeConsentRepository,
            KeyManagementService keyManagementService,
            Clock clock,
            @Value("${vface.consent.issuer:https://registry.v-face.org}") String issuer,
            @Value("${vface.consent.model-version:mobilefacenet_128d}") String modelVersion,
            @Value("${vface.consent.min-duration-seconds:60}") long minDurationSeconds,
            @Value("${vface.consent.max-duration-seconds:604800}") long maxDurationSeconds) {
        this.identityRepository = identityRepository;
        this.pendingRepository = pendingRepository;
        this.activeConsentRepository = activeConsentRepository;
        this.keyManagementService = keyManagementService;
        this.clock = clock;
        this.issuer = issuer;
        this.modelVersion = modelVersion;
        this.minDurationSeconds = minDurationSeconds;
        this.maxDurationSeconds = maxDurationSeconds;
    }

    /**
     * Stores a pending consent request from a company.
     *
     * @throws IdentityUnavailableException if the fingerprint is absent or revoked
     */
    @Transactional
    public ConsentRequestResult requestConsent(String fingerprint, String companyId, List<String> scope,
                                               long durationSeconds) {
        validateConsentRequest(fingerprint, companyId, scope, durationSeconds);
        requireActiveIdentity(fingerprint);

        PendingConsentRequest request = pendingRepository.save(
                PendingConsentRequest.create(fingerprint, companyId, scope, durationSeconds, clock.instant()));

        log.info("Consent requested by {} for {} ({}s, scope={})",
                companyId, prefix(fingerprint), durationSeconds, scope);
        return new ConsentRequestResult(STATUS_PENDING_APPROVAL, request.getRequestId(), fingerprint, companyId,
                request.getScope(), durationSeconds, request.getCreatedAt());
    }

    /**
     * Approves a pending request and mints its token. The request row is locked so a request
     * is approved at most once.
     */
    @Transactional
    public ConsentApproval approveConsent(UUID requestId, String fingerprint) {
        if (requestId == null) {
            throw new InvalidConsentRequestException("Request ID is required");
        }
        requireFingerprint(fingerprint);

        PendingConsentRequest request = pendingRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ConsentRequestNotFoundException(requestId));
        if (!request.isPending()) {
            throw new ConsentNotPendingException(requestId, request.getStatus());
        }
        if (!request.getFingerprint().equals(fingerprint)) {
            log.warn("Rejected approval of {}: fingerprint does not match request", requestId);
            throw new FingerprintMismatchException("Fingerprint does not match the consent request");
        }
        IdentityRecord identity = requireActiveIdentity(fingerprint);

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plusSeconds(request.getDurationSeconds());
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .issuer(issuer)
                .subject(identity.getOwnerKey())
                .audience().add(request.getCompanyId()).and()
                .claim(CLAIM_FINGERPRINT, fingerprint)
                .claim(CLAIM_SCOPE, request.getScope())
                .claim(CLAIM_MODEL_VERSION, modelVersion)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .id(tokenId)
                .signWith(keyManagementService.getPrivateKey(), Jwts.SIG.ES256)
                .compact();

        request.approve(issuedAt);
        ActiveConsent consent = activeConsentRepository.save(ActiveConsent.record(
                tokenId, requestId, fingerprint, request.getCompanyId(), request.getScope(), issuedAt, expiresAt));

        log.info("Consent {} approved for {}: token {} expires {}",
                requestId, request.getCompanyId(), tokenId, expiresAt);
        return new ConsentApproval(token, tokenId, consent.getConsentId(), issuedAt, expiresAt);
    }

    /**
     * Verifies a consent token. Never throws for bad tokens or storage failures; the result
     * carries the reason instead.
     *
     * @param expectedAudience if non-null, the token must name this audience
     */
    public TokenVerification verifyToken(String token, String expectedAudience) {
        if (token == null || token.isBlank()) {
            return TokenVerification.invalid("missing_token");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keyManagementService.getPublicKey())
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            return TokenVerification.invalid("token_expired");
        } catch (IncorrectClaimException | MissingClaimException e) {
            return TokenVerification.invalid("invalid_claims");
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected consent token: {}", e.getMessage());
            return TokenVerification.invalid("invalid_token");
        }

        String fingerprint = claims.get(CLAIM_FINGERPRINT, String.class);
        if (!Hashing.isSha256Hex(fingerprint)) {
            return TokenVerification.invalid("invalid_claims");
        }
        Set<String> audience = claims.getAudience();
        if (expectedAudience != null && (audience == null || !audience.contains(expectedAudience))) {
            return TokenVerification.invalid("audience_mismatch");
        }

        Optional<IdentityRecord> identity;
        try {
            identity = identityRepository.findByFingerprint(fingerprint);
        } catch (DataAccessException | TransactionException e) {
            log.error("Registry unavailable during token verification; denying token {}", claims.getId(), e);
            return TokenVerification.invalid("registry_unavailable");
        }
        if (identity.isEmpty()) {
            return TokenVerification.invalid("identity_not_found");
        }
        if (identity.get().isRevoked()) {
            return TokenVerification.invalid("identity_revoked");
        }

        return TokenVerification.valid(toConsentClaims(claims, fingerprint, audience));
    }

    @Transactional(readOnly = true)
    public List<ActiveConsent> listActiveConsents(String fingerprint) {
        requireFingerprint(fingerprint);
        Instant now = clock.instant();
        return activeConsentRepository.findByFingerprintOrderByIssuedAtDesc(fingerprint).stream()
                .filter(c -> !c.isExpired(now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PendingConsentRequest> listPendingRequests(String fingerprint) {
        requireFingerprint(fingerprint);
        return pendingRepository.findByFingerprintAndStatus(fingerprint, PendingConsentRequest.Status.PENDING);
    }

    private ConsentClaims toConsentClaims(Claims claims, String fingerprint, Set<String> audience) {
        Object rawScope = claims.get(CLAIM_SCOPE);
        List<String> scope = rawScope instanceof List<?> entries
                ? entries.stream().map(String::valueOf).toList()
                : List.of();
        return new ConsentClaims(
                claims.getIssuer(),
                claims.getSubject(),
                audience == null ? List.of() : List.copyOf(audience),
                fingerprint,
                scope,
                claims.get(CLAIM_MODEL_VERSION, String.class),
                claims.getId(),
                claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                claims.getExpiration() != null ? claims.getExpiration().toInstant() : null);
    }

    private IdentityRecord requireActiveIdentity(String fingerprint) {
        return identityRepository.findByFingerprint(fingerprint)
                .filter(r -> !r.isRevoked())
                .orElseThrow(() -> new IdentityUnavailableException(fingerprint));
    }

    private void validateConsentRequest(String fingerprint, String companyId, List<String> scope, long durationSeconds) {
        requireFingerprint(fingerprint);
        if (companyId == null || companyId.isBlank()) {
            throw new InvalidConsentRequestException("Company ID is required");
        }
        if (companyId.length() > MAX_COMPANY_ID_LENGTH) {
            throw new InvalidConsentRequestException("Company ID exceeds " + MAX_COMPANY_ID_LENGTH + " characters");
        }
        if (scope == null || scope.isEmpty()) {
            throw new InvalidConsentRequestException("Scope must contain at least one capability");
        }
        if (scope.size() > MAX_SCOPE_ENTRIES) {
            throw new InvalidConsentRequestException("Scope exceeds " + MAX_SCOPE_ENTRIES + " capabilities");
        }
        for (String capability : scope) {
            if (capability == null || capability.isBlank() || capability.length() > MAX_SCOPE_ENTRY_LENGTH) {
                throw new InvalidConsentRequestException(
                        "Scope entries must be non-blank and at most " + MAX_SCOPE_ENTRY_LENGTH + " characters");
            }
        }
        if (durationSeconds < minDurationSeconds || durationSeconds > maxDurationSeconds) {
            throw new InvalidConsentRequestException(
                    "Duration must be between " + minDurationSeconds + " and " + maxDurationSeconds + " seconds");
        }
    }

    private static void requireFingerprint(String fingerprint) {
        if (!Hashing.isSha256Hex(fingerprint)) {
            throw new InvalidConsentRequestException("Fingerprint must be 64 lowercase hex characters");
        }
    }

    private static String prefix(String fingerprint) {
        return fingerprint.substring(0, 16);
    }

    // Request/Result records
    public record ConsentRequestResult(String status, UUID requestId, String fingerprint, String companyId,
                                       List<String> scope, long durationSeconds, Instant createdAt) {}

    public record ConsentApproval(String token, String tokenId, UUID consentId, Instant issuedAt, Instant expiresAt) {
        @JsonProperty("success")
        public boolean success() {
            return token != null;
        }
    }

    public record ConsentClaims(String issuer, String subject, List<String> audience, String fingerprint,
                                List<String> scope, String modelVersion, String tokenId,
                                Instant issuedAt, Instant expiresAt) {}

    public record TokenVerification(boolean valid, String reason, ConsentClaims claims) {
        static TokenVerification valid(ConsentClaims claims) {
            return new TokenVerification(true, null, claims);
        }

        static TokenVerification invalid(String reason) {
            return new TokenVerification(false, reason, null);
        }

        public boolean isInfrastructureFailure() {
            return "registry_unavailable".equals(reason);
        }
    }

    // Exceptions
    public static class InvalidConsentRequestException extends ValidationException {
        public InvalidConsentRequestException(String message) { super("CONSENT_001", message); }
    }

    public static class IdentityUnavailableException extends NotFoundException {
        public IdentityUnavailableException(String fingerprint) {
            super("CONSENT_002", "Identity not found or revoked: " + prefix(fingerprint));
        }
    }

    public static class ConsentRequestNotFoundException extends NotFoundException {
        public ConsentRequestNotFoundException(UUID requestId) {
            super("CONSENT_003", "Pending consent request not found: " + requestId);
        }
    }

    public static class ConsentNotPendingException extends ConflictException {
        public ConsentNotPendingException(UUID requestId, PendingConsentRequest.Status status) {
            super("CONSENT_004", "Consent request " + requestId + " is " + status.name().toLowerCase(Locale.ROOT));
        }
    }

    public static class FingerprintMismatchException extends AuthorizationException {
        public FingerprintMismatchException(String message) { super("CONSENT_005", message); }
    }
}
