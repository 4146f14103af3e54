package com.vface.core.repository;

import com.vface.core.domain.IdentityRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Identity Records.
 */
@Repository
public interface IdentityRecordRepository extends JpaRepository<IdentityRecord, Long> {

    Optional<IdentityRecord> findByFingerprint(String fingerprint);

    boolean existsByFingerprint(String fingerprint);

    /**
     * Loads a record with a row lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM IdentityRecord r WHERE r.fingerprint = :fingerprint")
    Optional<IdentityRecord> findByFingerprintForUpdate(@Param("fingerprint") String fingerprint);

    @Query("SELECT r.fingerprint FROM IdentityRecord r WHERE r.ownerKey = :ownerKey ORDER BY r.id ASC")
    List<String> findFingerprintsByOwnerKey(@Param("ownerKey") String ownerKey);

    /**
     * Scan candidates for similarity matching, in insertion order.
     */
    @Query("SELECT r FROM IdentityRecord r WHERE r.revoked = false AND r.encryptedVector IS NOT NULL ORDER BY r.id ASC")
    List<IdentityRecord> findActiveWithVector();

    /**
     * Every record holding a sealed vector, locked for key rotation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM IdentityRecord r WHERE r.encryptedVector IS NOT NULL ORDER BY r.id ASC")
    List<IdentityRecord> findAllWithVectorForUpdate();

    long countByRevokedTrue();
}
