package com.vface.core.repository;

import com.vface.core.domain.ConsumedNonce;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for consumed proof-message nonces.
 */
@Repository
public interface ConsumedNonceRepository extends JpaRepository<ConsumedNonce, String> {

    /**
     * Deletes nonces whose replay window has closed.
     */
    @Modifying
    @Query("DELETE FROM ConsumedNonce n WHERE n.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
