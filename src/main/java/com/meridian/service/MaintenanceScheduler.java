package com.meridian.service;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.InMemoryCounterStore;
import com.meridian.model.dto.AdaptationResult;
import com.meridian.model.dto.CacheCleanupResult;
import com.meridian.service.cache.ResponseCacheService;
import com.meridian.service.telemetry.PolicyAdaptationService;
import com.meridian.service.telemetry.TelemetryAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping and tuning: stale reservations, expired cache entries, old telemetry
 * buckets and the telemetry adaptation pass.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final RoutingService routingService;
    private final ResponseCacheService cacheService;
    private final TelemetryAggregator telemetry;
    private final PolicyAdaptationService adaptationService;
    private final MeridianProperties properties;
    private final ObjectProvider<InMemoryCounterStore> inMemoryCounters;

    public MaintenanceScheduler(RoutingService routingService,
                                ResponseCacheService cacheService,
                                TelemetryAggregator telemetry,
                                PolicyAdaptationService adaptationService,
                                MeridianProperties properties,
                                ObjectProvider<InMemoryCounterStore> inMemoryCounters) {
        this.routingService = routingService;
        this.cacheService = cacheService;
        this.telemetry = telemetry;
        this.adaptationService = adaptationService;
        this.properties = properties;
        this.inMemoryCounters = inMemoryCounters;
    }

    @Scheduled(fixedDelayString = "${meridian.maintenance.reservation-sweep-interval:60000}",
            initialDelayString = "${meridian.maintenance.reservation-sweep-interval:60000}")
    public void sweepReservations() {
        int settled = routingService.settleStaleReservations();
        if (settled > 0) {
            log.warn("Settled {} abandoned reservations at their estimate", settled);
        }
    }

    @Scheduled(fixedDelayString = "${meridian.maintenance.cache-cleanup-interval:3600000}",
            initialDelayString = "${meridian.maintenance.cache-cleanup-interval:3600000}")
    public void cleanupCache() {
        if (!cacheService.isEnabled()) {
            return;
        }
        CacheCleanupResult result = cacheService.cleanup();
        log.info("Cache cleanup: {} expired, {} evicted, {} remaining",
                result.getExpiredRemoved(), result.getEvicted(), result.getRemaining());
    }

    @Scheduled(fixedDelayString = "${meridian.maintenance.telemetry-prune-interval:3600000}",
            initialDelayString = "${meridian.maintenance.telemetry-prune-interval:3600000}")
    public void pruneTelemetry() {
        int removed = telemetry.prune();
        log.debug("Telemetry prune removed {} buckets", removed);

        InMemoryCounterStore counters = inMemoryCounters.getIfAvailable();
        if (counters != null) {
            log.debug("Purged {} expired counters", counters.purgeExpired());
        }
    }

    @Scheduled(fixedDelayString = "${meridian.maintenance.adaptation-interval:900000}",
            initialDelayString = "${meridian.maintenance.adaptation-interval:900000}")
    public void adaptPolicies() {
        if (!properties.getAdaptation().isEnabled()) {
            return;
        }
        AdaptationResult result = adaptationService.adapt();
        result.getRecommendations().forEach(recommendation -> log.info("Adaptation: {}", recommendation));
    }
}
