package com.vface.core.repository;

import com.vface.core.domain.ChainEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for hash chain entries. Entries are only ever inserted.
 */
@Repository
public interface ChainEntryRepository extends JpaRepository<ChainEntry, Long> {

    Optional<ChainEntry> findTopByOrderByChainIndexDesc();

    List<ChainEntry> findByChainIndexBetweenOrderByChainIndexAsc(long from, long to);

    List<ChainEntry> findAllByOrderByChainIndexAsc();

    Optional<ChainEntry> findFirstByFingerprintOrderByChainIndexDesc(String fingerprint);
}
