package com.meridian.repository;

import com.meridian.entity.CacheEntryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for response cache entries.
 */
@Repository
public interface CacheEntryRepository extends JpaRepository<CacheEntryEntity, UUID> {

    Optional<CacheEntryEntity> findByCacheKey(String cacheKey);

    boolean existsByCacheKey(String cacheKey);

    /**
     * Atomically record a hit.
     */
    @Modifying
    @Query("UPDATE CacheEntryEntity e SET e.hitCount = e.hitCount + 1, e.lastAccessedAt = :now WHERE e.cacheKey = :cacheKey")
    int incrementHitCount(@Param("cacheKey") String cacheKey, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM CacheEntryEntity e WHERE e.cacheKey = :cacheKey")
    int deleteByCacheKey(@Param("cacheKey") String cacheKey);

    /**
     * Delete expired entries.
     */
    @Modifying
    @Query("DELETE FROM CacheEntryEntity e WHERE e.expiresAt IS NOT NULL AND e.expiresAt <= :now")
    int deleteExpiredEntries(@Param("now") Instant now);

    /**
     * Count active entries (not expired).
     */
    @Query("SELECT COUNT(e) FROM CacheEntryEntity e WHERE e.expiresAt IS NULL OR e.expiresAt > :now")
    long countActiveEntries(@Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(e.hitCount), 0) FROM CacheEntryEntity e")
    long sumHitCount();

    /**
     * Least recently accessed entries with fewer than {@code minHits} hits.
     */
    List<CacheEntryEntity> findByHitCountLessThanOrderByLastAccessedAtAsc(int minHits, Pageable pageable);

    List<CacheEntryEntity> findAllByOrderByLastAccessedAtAsc(Pageable pageable);

    /**
     * Rows of [provider, model, entries, hits].
     */
    @Query("SELECT e.provider, e.model, COUNT(e), COALESCE(SUM(e.hitCount), 0) FROM CacheEntryEntity e GROUP BY e.provider, e.model")
    List<Object[]> statisticsByModel();
}
