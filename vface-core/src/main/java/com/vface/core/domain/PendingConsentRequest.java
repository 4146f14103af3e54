package com.vface.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pending Consent Request - a company's request to rely on a fingerprint, awaiting the owner's approval.
 * Transitions once from PENDING to APPROVED.
 */
@Entity
@Table(name = "pending_consents", indexes = {
    @Index(name = "idx_pending_fingerprint", columnList = "fingerprint")
})
public class PendingConsentRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
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

    @Column(name = "duration_seconds", nullable = false)
    private long durationSeconds;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Version
    private Long version;

    public enum Status {
        PENDING,
        APPROVED
    }

    protected PendingConsentRequest() {}

    public static PendingConsentRequest create(String fingerprint, String companyId, List<String> scope,
                                               long durationSeconds, Instant createdAt) {
        PendingConsentRequest request = new PendingConsentRequest();
        request.fingerprint = fingerprint;
        request.companyId = companyId;
        request.scope = new ArrayList<>(scope);
        request.durationSeconds = durationSeconds;
        request.createdAt = createdAt;
        request.status = Status.PENDING;
        return request;
    }

    public void approve(Instant at) {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Consent request " + requestId + " is already " + status);
        }
        this.status = Status.APPROVED;
        this.approvedAt = at;
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }

    // Getters
    public UUID getRequestId() { return requestId; }
    public String getFingerprint() { return fingerprint; }
    public String getCompanyId() { return companyId; }
    public List<String> getScope() { return List.copyOf(scope); }
    public long getDurationSeconds() { return durationSeconds; }
    public Instant getCreatedAt() { return createdAt; }
    public Status getStatus() { return status; }
    public Instant getApprovedAt() { return approvedAt; }
}
