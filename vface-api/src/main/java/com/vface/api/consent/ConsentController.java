package com.vface.api.consent;

import com.vface.core.domain.ActiveConsent;
import com.vface.core.domain.PendingConsentRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for the consent lifecycle: a company requests, the user approves, anyone verifies.
 */
@RestController
@RequestMapping("/api/v1/consent")
public class ConsentController {

    private static final String FINGERPRINT_PATTERN = "^[a-f0-9]{64}$";

    private final ConsentTokenService consentService;

    public ConsentController(ConsentTokenService consentService) {
        this.consentService = consentService;
    }

    /**
     * Request consent from the holder of a fingerprint.
     * POST /api/v1/consent/request
     */
    @PostMapping("/request")
    public ResponseEntity<ConsentTokenService.ConsentRequestResult> requestConsent(
            @Valid @RequestBody ConsentRequestBody request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(consentService.requestConsent(
                request.fingerprint(), request.companyId(), request.scope(), request.durationSeconds()));
    }

    /**
     * Approve a pending request and receive the signed token.
     * POST /api/v1/consent/approve
     */
    @PostMapping("/approve")
    public ResponseEntity<ConsentTokenService.ConsentApproval> approveConsent(
            @Valid @RequestBody ApproveRequest request) {
        return ResponseEntity.ok(consentService.approveConsent(request.requestId(), request.fingerprint()));
    }

    /**
     * Verify a token against the live registry.
     * POST /api/v1/consent/verify
     */
    @PostMapping("/verify")
    public ResponseEntity<ConsentTokenService.TokenVerification> verifyToken(@RequestBody VerifyRequest request) {
        ConsentTokenService.TokenVerification result =
                consentService.verifyToken(request.token(), request.audience());
        if (result.isInfrastructureFailure()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/active/{fingerprint}")
    public ResponseEntity<List<ConsentView>> getActiveConsents(@PathVariable String fingerprint) {
        return ResponseEntity.ok(consentService.listActiveConsents(fingerprint).stream()
                .map(ConsentView::from)
                .toList());
    }

    @GetMapping("/pending/{fingerprint}")
    public ResponseEntity<List<PendingView>> getPendingRequests(@PathVariable String fingerprint) {
        return ResponseEntity.ok(consentService.listPendingRequests(fingerprint).stream()
                .map(PendingView::from)
                .toList());
    }

    // Request/Response DTOs

    public record ConsentRequestBody(
            @NotBlank @Pattern(regexp = FINGERPRINT_PATTERN) String fingerprint,
            @NotBlank @Size(max = 256) String companyId,
            @NotEmpty @Size(max = 32) List<String> scope,
            @Min(1) long durationSeconds
    ) {}

    public record ApproveRequest(
            @NotNull UUID requestId,
            @NotBlank @Pattern(regexp = FINGERPRINT_PATTERN) String fingerprint
    ) {}

    public record VerifyRequest(String token, String audience) {}

    public record ConsentView(UUID consentId, String tokenId, UUID requestId, String companyId,
                              List<String> scope, Instant issuedAt, Instant expiresAt) {
        static ConsentView from(ActiveConsent consent) {
            return new ConsentView(consent.getConsentId(), consent.getTokenId(), consent.getRequestId(),
                    consent.getCompanyId(), consent.getScope(), consent.getIssuedAt(), consent.getExpiresAt());
        }
    }

    public record PendingView(UUID requestId, String companyId, List<String> scope, long durationSeconds,
                              Instant createdAt) {
        static PendingView from(PendingConsentRequest request) {
            return new PendingView(request.getRequestId(), request.getCompanyId(), request.getScope(),
                    request.getDurationSeconds(), request.getCreatedAt());
        }
    }
}
