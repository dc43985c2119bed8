package com.meridian.service.cache;

import com.meridian.config.JacksonConfiguration;
import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.entity.CacheEntryEntity;
import com.meridian.model.dto.CacheCleanupResult;
import com.meridian.model.dto.CacheStatistics;
import com.meridian.repository.CacheEntryRepository;
import com.meridian.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ResponseCacheService.
 */
class ResponseCacheServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private CacheEntryRepository repository;
    private MeridianProperties properties;
    private ResponseCacheService cacheService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = mock(CacheEntryRepository.class);
        properties = new MeridianProperties();
        cacheService = new ResponseCacheService(repository,
                new PromptCanonicalizer(JacksonConfiguration.createObjectMapper()),
                properties, new MonotonicClock(clock));
    }

    @Test
    void testStoreThenHitReturnsSamePayloadAndCountsHits() {
        String key = cacheService.computeKey("Summarize: Q3 revenue grew 12%", "openai", "gpt-4o-mini", null);
        AtomicReference<CacheEntryEntity> stored = new AtomicReference<>();
        AtomicInteger hits = new AtomicInteger();

        when(repository.existsByCacheKey(key)).thenReturn(false);
        when(repository.saveAndFlush(any(CacheEntryEntity.class))).thenAnswer(inv -> {
            stored.set(inv.getArgument(0));
            return inv.getArgument(0);
        });
        when(repository.findByCacheKey(key)).thenAnswer(inv -> Optional.ofNullable(stored.get())
                .map(entry -> withHits(entry, hits.get())));
        when(repository.incrementHitCount(eq(key), any())).thenAnswer(inv -> {
            hits.incrementAndGet();
            return 1;
        });

        assertTrue(cacheService.store(key, "openai", "gpt-4o-mini", "Revenue rose 12% in Q3.", 40, 12, 0.00002));

        CacheLookup first = cacheService.lookup(key);
        CacheLookup second = cacheService.lookup(key);

        assertTrue(first.hit());
        assertEquals("Revenue rose 12% in Q3.", first.completion());
        assertEquals(1, first.hitCount());
        assertEquals(2, second.hitCount());
        assertEquals(first.completion(), second.completion());
        assertEquals(NOW.plus(Duration.ofHours(24)), stored.get().getExpiresAt());
    }

    @Test
    void testStoreIsIdempotentOnExistingKey() {
        when(repository.existsByCacheKey("k")).thenReturn(true);

        assertFalse(cacheService.store("k", "openai", "gpt-4o", "text", 1, 1, 0.01));
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void testConcurrentStoreLosesGracefully() {
        when(repository.existsByCacheKey("k")).thenReturn(false);
        when(repository.saveAndFlush(any(CacheEntryEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertFalse(cacheService.store("k", "openai", "gpt-4o", "text", 1, 1, 0.01));
    }

    @Test
    void testExpiredEntryIsMiss() {
        when(repository.findByCacheKey("k")).thenReturn(Optional.of(entry("k", 0, NOW.minusSeconds(1))));

        CacheLookup lookup = cacheService.lookup("k");

        assertFalse(lookup.hit());
        verify(repository, never()).incrementHitCount(anyString(), any());
    }

    @Test
    void testRepositoryFailureIsMiss() {
        when(repository.findByCacheKey("k")).thenThrow(new DataAccessResourceFailureException("down"));

        assertFalse(cacheService.lookup("k").hit());
        assertEquals(1, cacheService.statistics().getSessionMisses());
    }

    @Test
    void testDisabledCacheNeverHits() {
        properties.getCache().setEnabled(false);

        assertFalse(cacheService.lookup("k").hit());
        assertFalse(cacheService.store("k", "openai", "gpt-4o", "text", 1, 1, 0.01));
        verify(repository, never()).findByCacheKey(anyString());
    }

    @Test
    void testStatisticsTrackSavings() {
        when(repository.findByCacheKey("k")).thenReturn(Optional.of(entry("k", 3, NOW.plusSeconds(60))));
        when(repository.findByCacheKey("missing")).thenReturn(Optional.empty());
        List<Object[]> rows = new ArrayList<>();
        rows.add(new Object[]{"openai", "gpt-4o", 1L, 4L});
        when(repository.statisticsByModel()).thenReturn(rows);
        when(repository.count()).thenReturn(1L);
        when(repository.countActiveEntries(any())).thenReturn(1L);
        when(repository.sumHitCount()).thenReturn(4L);

        cacheService.lookup("k");
        cacheService.lookup("missing");
        CacheStatistics stats = cacheService.statistics();

        assertEquals(1, stats.getSessionHits());
        assertEquals(1, stats.getSessionMisses());
        assertEquals(0.5, stats.getHitRate(), 1e-9);
        assertEquals(0.01, stats.getCostSavedUsd(), 1e-9);
        assertEquals(4, stats.getTotalHits());
        assertEquals("gpt-4o", stats.getByModel().get(0).getModel());
    }

    @Test
    void testCleanupEvictsLowHitEntriesFirst() {
        properties.getCache().setMaxEntries(2);
        when(repository.deleteExpiredEntries(NOW)).thenReturn(3);
        when(repository.count()).thenReturn(5L);

        CacheEntryEntity cold = entry("cold", 0, NOW.plusSeconds(60));
        CacheEntryEntity warm = entry("warm", 1, NOW.plusSeconds(60));
        CacheEntryEntity popular = entry("popular", 10, NOW.plusSeconds(60));
        when(repository.findByHitCountLessThanOrderByLastAccessedAtAsc(eq(2), any(Pageable.class)))
                .thenReturn(List.of(cold, warm));
        when(repository.findAllByOrderByLastAccessedAtAsc(any(Pageable.class)))
                .thenReturn(List.of(cold, popular, warm));

        CacheCleanupResult result = cacheService.cleanup();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Iterable<CacheEntryEntity>> victims = ArgumentCaptor.forClass(Iterable.class);
        verify(repository).deleteAllInBatch(victims.capture());
        List<String> keys = new ArrayList<>();
        victims.getValue().forEach(e -> keys.add(e.getCacheKey()));

        assertEquals(List.of("cold", "warm", "popular"), keys);
        assertEquals(3, result.getExpiredRemoved());
        assertEquals(3, result.getEvicted());
        assertEquals(2, result.getRemaining());
    }

    @Test
    void testCleanupWithinCapacityOnlyRemovesExpired() {
        when(repository.deleteExpiredEntries(NOW)).thenReturn(1);
        when(repository.count()).thenReturn(10L);

        CacheCleanupResult result = cacheService.cleanup();

        assertEquals(1, result.getExpiredRemoved());
        assertEquals(0, result.getEvicted());
        verify(repository, never()).findByHitCountLessThanOrderByLastAccessedAtAsc(anyInt(), any());
    }

    private static CacheEntryEntity entry(String key, int hits, Instant expiresAt) {
        return CacheEntryEntity.builder()
                .id(UUID.randomUUID())
                .cacheKey(key)
                .provider("openai")
                .model("gpt-4o")
                .completion("cached text")
                .tokensIn(100)
                .tokensOut(50)
                .estimatedCost(0.01)
                .hitCount(hits)
                .createdAt(NOW.minusSeconds(3600))
                .lastAccessedAt(NOW.minusSeconds(60))
                .expiresAt(expiresAt)
                .build();
    }

    private static CacheEntryEntity withHits(CacheEntryEntity source, int hits) {
        return CacheEntryEntity.builder()
                .id(source.getId())
                .cacheKey(source.getCacheKey())
                .provider(source.getProvider())
                .model(source.getModel())
                .completion(source.getCompletion())
                .tokensIn(source.getTokensIn())
                .tokensOut(source.getTokensOut())
                .estimatedCost(source.getEstimatedCost())
                .hitCount(hits)
                .createdAt(source.getCreatedAt())
                .lastAccessedAt(source.getLastAccessedAt())
                .expiresAt(source.getExpiresAt())
                .build();
    }
}
