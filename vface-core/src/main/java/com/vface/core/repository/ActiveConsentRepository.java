package com.vface.core.repository;

import com.vface.core.domain.ActiveConsent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActiveConsentRepository extends JpaRepository<ActiveConsent, UUID> {

    List<ActiveConsent> findByFingerprintOrderByIssuedAtDesc(String fingerprint);

    Optional<ActiveConsent> findByTokenId(String tokenId);
}
