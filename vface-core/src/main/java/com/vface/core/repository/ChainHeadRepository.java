package com.vface.core.repository;

import com.vface.core.domain.ChainHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChainHeadRepository extends JpaRepository<ChainHead, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM ChainHead h WHERE h.id = :id")
    Optional<ChainHead> lockById(@Param("id") Integer id);
}
