package com.vface.api.registry;

import com.vface.api.config.OperatorApiKeyFilter;
import com.vface.api.matching.SimilarityMatcher;
import com.vface.api.matching.VectorMatch;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for identity registration, lookup, revocation and similarity search.
 */
@RestController
@RequestMapping("/api/v1/identities")
public class RegistryController {

    private static final String FINGERPRINT_PATTERN = "^[a-f0-9]{64}$";
    private static final String FINGERPRINT_MESSAGE = "must be 64 lowercase hex characters";

    private final IdentityRegistryService registryService;
    private final SimilarityMatcher similarityMatcher;

    public RegistryController(IdentityRegistryService registryService, SimilarityMatcher similarityMatcher) {
        this.registryService = registryService;
        this.similarityMatcher = similarityMatcher;
    }

    /**
     * Register an identity.
     * POST /api/v1/identities
     */
    @PostMapping
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        IdentityRegistryService.RegistrationResult result = registryService.register(
                new IdentityRegistryService.RegistrationRequest(
                        request.fingerprint(), request.ownerKey(), request.vector(), request.metadata()));
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(
                true, result.id(), result.fingerprint(), result.commitment(),
                result.chainIndex(), result.entryHash(), result.chainSignature()));
    }

    /**
     * Look up an identity. Operators also receive the decrypted vector.
     * POST /api/v1/identities/check
     */
    @PostMapping("/check")
    public ResponseEntity<IdentityRegistryService.CheckResult> check(
            @Valid @RequestBody FingerprintRequest request,
            Authentication authentication) {
        boolean operator = OperatorApiKeyFilter.isOperator(authentication);
        return ResponseEntity.ok(registryService.check(request.fingerprint(), operator));
    }

    /**
     * Revoke an identity with an owner-signed message.
     * POST /api/v1/identities/revoke
     */
    @PostMapping("/revoke")
    public ResponseEntity<RevokeResponse> revoke(@Valid @RequestBody RevokeRequest request) {
        IdentityRegistryService.RevocationResult result =
                registryService.revoke(request.fingerprint(), request.signature(), request.message());
        return ResponseEntity.ok(new RevokeResponse(true, result.fingerprint(), result.revokedAt()));
    }

    /**
     * List fingerprints registered to an owner.
     * POST /api/v1/identities/owner
     */
    @PostMapping("/owner")
    public ResponseEntity<OwnerResponse> listByOwner(@Valid @RequestBody OwnerRequest request) {
        return ResponseEntity.ok(new OwnerResponse(request.ownerKey(), registryService.listByOwner(request.ownerKey())));
    }

    /**
     * Find enrolled identities similar to a vector.
     * POST /api/v1/identities/search
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        double threshold = request.threshold() != null
                ? request.threshold()
                : similarityMatcher.getVerificationThreshold();
        List<VectorMatch> matches = similarityMatcher.search(request.vector(), threshold, request.topK());
        return ResponseEntity.ok(new SearchResponse(matches, threshold));
    }

    /**
     * Derive the fingerprint of a vector without storing anything.
     * POST /api/v1/identities/fingerprint
     */
    @PostMapping("/fingerprint")
    public ResponseEntity<FingerprintResponse> fingerprint(@Valid @RequestBody VectorRequest request) {
        return ResponseEntity.ok(new FingerprintResponse(registryService.deriveFingerprint(request.vector())));
    }

    // Request/Response DTOs
    public record RegisterRequest(
            @NotBlank @Pattern(regexp = FINGERPRINT_PATTERN, message = FINGERPRINT_MESSAGE) String fingerprint,
            @NotBlank @Size(max = IdentityRegistryService.MAX_OWNER_KEY_LENGTH) String ownerKey,
            double[] vector,
            Map<String, Object> metadata
    ) {}

    public record RegisterResponse(boolean success, long id, String fingerprint, String commitment,
                                   Long chainIndex, String entryHash, String chainSignature) {}

    public record FingerprintRequest(
            @NotBlank @Pattern(regexp = FINGERPRINT_PATTERN, message = FINGERPRINT_MESSAGE) String fingerprint
    ) {}

    public record RevokeRequest(
            @NotBlank @Pattern(regexp = FINGERPRINT_PATTERN, message = FINGERPRINT_MESSAGE) String fingerprint,
            @NotBlank String signature,
            @NotNull RevocationMessage message
    ) {}

    public record RevokeResponse(boolean success, String fingerprint, Instant revokedAt) {}

    public record OwnerRequest(@NotBlank String ownerKey) {}

    public record OwnerResponse(String ownerKey, List<String> fingerprints) {}

    public record SearchRequest(@NotNull double[] vector, Double threshold, Integer topK) {}

    public record SearchResponse(List<VectorMatch> matches, double threshold) {}

    public record VectorRequest(@NotNull double[] vector) {}

    public record FingerprintResponse(String fingerprint) {}
}
