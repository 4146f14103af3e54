package com.vface.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Active Consent - log entry for an issued consent token.
 * Informational only; token verification never reads it.
 */
@Entity
@Table(name = "active_consents", indexes = {
    @Index(name = "idx_active_fingerprint", columnList = "fingerprint"),
    @Index(name = "idx_active_token_id", columnList = "token_id", unique = true)
})
public class ActiveConsent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "consent_id")
    private UUID consentId;

    @NotNull
    @Column(name = "token_id", nullable = false, unique = true, length = 64)
    private String tokenId;

    @Column(name = "request_id")
    private UUID requestId;

    @NotNull
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @NotNull
    @Column(name = "company_id", nullable = false, length = 256)
    private String companyId;

    @Convert(converter = ScopeListConverter.class)
    @Column(name = "scope", nullable = false, length = 4096)
    private List<String> scope = new ArrayList<>();

    @NotNull
    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected ActiveConsent() {}

    public static ActiveConsent record(String tokenId, UUID requestId, String fingerprint, String companyId,
                                       List<String> scope, Instant issuedAt, Instant expiresAt) {
        ActiveConsent consent = new ActiveConsent();
        consent.tokenId = tokenId;
        consent.requestId = requestId;
        consent.fingerprint = fingerprint;
        consent.companyId = companyId;
        consent.scope = new ArrayList<>(scope);
        consent.issuedAt = issuedAt;
        consent.expiresAt = expiresAt;
        return consent;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public UUID getConsentId() { return consentId; }
    public String getTokenId() { return tokenId; }
    public UUID getRequestId() { return requestId; }
    public String getFingerprint() { return fingerprint; }
    public String getCompanyId() { return companyId; }
    public List<String> getScope() { return List.copyOf(scope); }
    public Instant getIssuedAt() { return issuedAt; }
    public Instant getExpiresAt() { return expiresAt; }
}
