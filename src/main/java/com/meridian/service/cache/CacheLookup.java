package com.meridian.service.cache;

import com.meridian.entity.CacheEntryEntity;

/**
 * Result of a cache lookup. On a hit, {@code hitCount} already includes this hit.
 */
public record CacheLookup(
        boolean hit,
        String cacheKey,
        String provider,
        String model,
        String completion,
        int hitCount,
        double estimatedCost) {

    public static CacheLookup hit(CacheEntryEntity entry) {
        int previousHits = entry.getHitCount() != null ? entry.getHitCount() : 0;
        return new CacheLookup(true, entry.getCacheKey(), entry.getProvider(), entry.getModel(),
                entry.getCompletion(), previousHits + 1,
                entry.getEstimatedCost() != null ? entry.getEstimatedCost() : 0.0);
    }

    public static CacheLookup miss(String cacheKey) {
        return new CacheLookup(false, cacheKey, null, null, null, 0, 0.0);
    }
}
