package com.meridian.controller;

import com.meridian.model.CircuitState;
import com.meridian.model.dto.CacheCleanupResult;
import com.meridian.model.dto.CacheStatistics;
import com.meridian.model.dto.GuardrailStatus;
import com.meridian.service.RateLimiter;
import com.meridian.service.RoutingService;
import com.meridian.service.cache.ResponseCacheService;
import com.meridian.service.telemetry.CircuitBreakerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin API for guardrail usage, the response cache and circuit state.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final RoutingService routingService;
    private final RateLimiter rateLimiter;
    private final ResponseCacheService cacheService;
    private final CircuitBreakerService circuitBreaker;

    public AdminController(RoutingService routingService,
                           RateLimiter rateLimiter,
                           ResponseCacheService cacheService,
                           CircuitBreakerService circuitBreaker) {
        this.routingService = routingService;
        this.rateLimiter = rateLimiter;
        this.cacheService = cacheService;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Today's spend, in-flight count and rate window usage for an organization.
     */
    @GetMapping("/usage/{orgId}")
    public ResponseEntity<GuardrailStatus> getUsage(@PathVariable String orgId) {
        return ResponseEntity.ok(routingService.guardrailStatus(orgId));
    }

    /**
     * Clear an organization's rate windows.
     */
    @DeleteMapping("/rate/{orgId}")
    public ResponseEntity<Void> resetRateWindows(@PathVariable String orgId) {
        log.warn("Admin: Resetting rate windows for org={}", orgId);

        rateLimiter.reset(orgId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/cache/cleanup")
    public ResponseEntity<CacheCleanupResult> cleanupCache() {
        log.info("Admin: Running cache cleanup");

        return ResponseEntity.ok(cacheService.cleanup());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> getCacheStatistics() {
        return ResponseEntity.ok(cacheService.statistics());
    }

    @DeleteMapping("/cache/entries/{cacheKey}")
    public ResponseEntity<Void> invalidateCacheEntry(@PathVariable String cacheKey) {
        log.info("Admin: Invalidating cache entry key={}", cacheKey);

        return cacheService.invalidate(cacheKey)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Clear all cache entries.
     *
     * @param confirm Must be "yes" to proceed
     */
    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache(@RequestParam(required = false) String confirm) {
        if (!"yes".equals(confirm)) {
            return ResponseEntity.badRequest()
                    .body("Must provide confirm=yes to clear cache");
        }

        log.warn("Admin: Clearing ALL cache entries");
        cacheService.clear();

        return ResponseEntity.noContent().build();
    }

    @GetMapping("/circuits")
    public ResponseEntity<List<CircuitState>> getCircuits() {
        return ResponseEntity.ok(circuitBreaker.states());
    }

    @GetMapping("/circuits/{provider}/{model}")
    public ResponseEntity<CircuitState> getCircuit(@PathVariable String provider, @PathVariable String model) {
        return ResponseEntity.ok(circuitBreaker.stateOf(provider, model));
    }

    @PostMapping("/circuits/{provider}/{model}/reset")
    public ResponseEntity<CircuitState> resetCircuit(@PathVariable String provider, @PathVariable String model) {
        log.warn("Admin: Resetting circuit for {}:{}", provider, model);

        return ResponseEntity.ok(circuitBreaker.reset(provider, model));
    }
}
