package com.meridian.service.cache;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.entity.CacheEntryEntity;
import com.meridian.model.dto.CacheCleanupResult;
import com.meridian.model.dto.CacheStatistics;
import com.meridian.repository.CacheEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Content-addressed cache of completions.
 *
 * Entries are immutable once written except for hit count and last access time.
 * Cache failures are logged and treated as misses; they never fail a routing request.
 */
@Slf4j
@Service
public class ResponseCacheService {

    private final CacheEntryRepository repository;
    private final PromptCanonicalizer canonicalizer;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    private final AtomicLong sessionHits = new AtomicLong();
    private final AtomicLong sessionMisses = new AtomicLong();
    private final DoubleAdder costSaved = new DoubleAdder();

    public ResponseCacheService(
            CacheEntryRepository repository,
            PromptCanonicalizer canonicalizer,
            MeridianProperties properties,
            MonotonicClock clock) {
        this.repository = repository;
        this.canonicalizer = canonicalizer;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.getCache().isEnabled();
    }

    public String computeKey(String prompt, String provider, String model, Map<String, Object> parameters) {
        return canonicalizer.computeKey(prompt, provider, model, parameters);
    }

    /**
     * Look up a completion. A hit records the access and the cost it saved.
     */
    @Transactional
    public CacheLookup lookup(String cacheKey) {
        if (!isEnabled() || cacheKey == null) {
            return CacheLookup.miss(cacheKey);
        }

        Instant now = clock.instant();
        try {
            Optional<CacheEntryEntity> entry = repository.findByCacheKey(cacheKey);
            if (entry.isEmpty() || entry.get().isExpired(now)) {
                sessionMisses.incrementAndGet();
                log.debug("Cache MISS key={}", cacheKey);
                return CacheLookup.miss(cacheKey);
            }

            repository.incrementHitCount(cacheKey, now);
            CacheLookup hit = CacheLookup.hit(entry.get());

            sessionHits.incrementAndGet();
            costSaved.add(Math.max(0.0, hit.estimatedCost() - properties.getCache().getNominalServingCostUsd()));
            log.info("Cache HIT key={} model={}:{} hits={}", cacheKey, hit.provider(), hit.model(), hit.hitCount());
            return hit;

        } catch (DataAccessException e) {
            log.error("Error reading response cache, treating as miss", e);
            sessionMisses.incrementAndGet();
            return CacheLookup.miss(cacheKey);
        }
    }

    /**
     * Store a completion. Idempotent: an existing entry for the key is left untouched.
     *
     * @return true if a new entry was written
     */
    public boolean store(String cacheKey, String provider, String model, String completion,
                         Integer tokensIn, Integer tokensOut, double estimatedCost, Duration ttl) {
        if (!isEnabled() || cacheKey == null || completion == null) {
            return false;
        }

        Instant now = clock.instant();
        Duration effectiveTtl = ttl != null ? ttl : properties.getCache().getTtl();
        try {
            if (repository.existsByCacheKey(cacheKey)) {
                log.debug("Cache entry already present for key={}", cacheKey);
                return false;
            }
            repository.saveAndFlush(CacheEntryEntity.builder()
                    .cacheKey(cacheKey)
                    .provider(provider)
                    .model(model)
                    .completion(completion)
                    .tokensIn(tokensIn)
                    .tokensOut(tokensOut)
                    .estimatedCost(estimatedCost)
                    .hitCount(0)
                    .createdAt(now)
                    .lastAccessedAt(now)
                    .expiresAt(now.plus(effectiveTtl))
                    .build());
            log.debug("Stored cache entry key={} model={}:{}", cacheKey, provider, model);
            return true;

        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent store for key={}, keeping existing entry", cacheKey);
            return false;
        } catch (DataAccessException e) {
            log.error("Error storing cache entry for key={}", cacheKey, e);
            return false;
        }
    }

    public boolean store(String cacheKey, String provider, String model, String completion,
                         Integer tokensIn, Integer tokensOut, double estimatedCost) {
        return store(cacheKey, provider, model, completion, tokensIn, tokensOut, estimatedCost, null);
    }

    /**
     * Delete expired entries, then evict down to the configured capacity: least recently
     * accessed entries below the retention hit count first, then least recently accessed overall.
     */
    @Transactional
    public CacheCleanupResult cleanup() {
        Instant now = clock.instant();
        int expired = repository.deleteExpiredEntries(now);

        long count = repository.count();
        long maxEntries = properties.getCache().getMaxEntries();
        int evicted = 0;

        if (count > maxEntries) {
            int excess = (int) Math.min(Integer.MAX_VALUE, count - maxEntries);
            List<CacheEntryEntity> victims = new ArrayList<>(repository.findByHitCountLessThanOrderByLastAccessedAtAsc(
                    properties.getCache().getMinHitsToRetain(), PageRequest.of(0, excess)));

            if (victims.size() < excess) {
                List<UUID> chosen = victims.stream().map(CacheEntryEntity::getId).toList();
                for (CacheEntryEntity entry : repository.findAllByOrderByLastAccessedAtAsc(
                        PageRequest.of(0, excess + victims.size()))) {
                    if (victims.size() >= excess) {
                        break;
                    }
                    if (!chosen.contains(entry.getId())) {
                        victims.add(entry);
                    }
                }
            }

            repository.deleteAllInBatch(victims);
            evicted = victims.size();
            count -= evicted;
        }

        if (expired > 0 || evicted > 0) {
            log.info("Cache cleanup removed {} expired and evicted {} entries, {} remain", expired, evicted, count);
        }
        return CacheCleanupResult.builder()
                .expiredRemoved(expired)
                .evicted(evicted)
                .remaining(count)
                .build();
    }

    @Transactional
    public boolean invalidate(String cacheKey) {
        boolean removed = repository.deleteByCacheKey(cacheKey) > 0;
        log.info("Invalidated cache key={} removed={}", cacheKey, removed);
        return removed;
    }

    /**
     * Remove every entry.
     */
    @Transactional
    public void clear() {
        repository.deleteAllInBatch();
        log.warn("Response cache cleared");
    }

    /**
     * Get cache statistics.
     */
    public CacheStatistics statistics() {
        Instant now = clock.instant();
        long hits = sessionHits.get();
        long misses = sessionMisses.get();
        long total = hits + misses;

        Map<String, CacheStatistics.ModelStatistics> byModel = new LinkedHashMap<>();
        for (Object[] row : repository.statisticsByModel()) {
            String provider = (String) row[0];
            String model = (String) row[1];
            byModel.put(provider + ":" + model, CacheStatistics.ModelStatistics.builder()
                    .provider(provider)
                    .model(model)
                    .entries(((Number) row[2]).longValue())
                    .hits(((Number) row[3]).longValue())
                    .build());
        }

        return CacheStatistics.builder()
                .totalEntries(repository.count())
                .activeEntries(repository.countActiveEntries(now))
                .totalHits(repository.sumHitCount())
                .sessionHits(hits)
                .sessionMisses(misses)
                .hitRate(total == 0 ? 0.0 : (double) hits / total)
                .costSavedUsd(costSaved.sum())
                .byModel(new ArrayList<>(byModel.values()))
                .build();
    }
}
