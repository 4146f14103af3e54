package com.vface.core.repository;

import com.vface.core.domain.PendingConsentRequest;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingConsentRequestRepository extends JpaRepository<PendingConsentRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PendingConsentRequest p WHERE p.requestId = :requestId")
    Optional<PendingConsentRequest> findByIdForUpdate(@Param("requestId") UUID requestId);

    List<PendingConsentRequest> findByFingerprintAndStatus(String fingerprint, PendingConsentRequest.Status status);
}
