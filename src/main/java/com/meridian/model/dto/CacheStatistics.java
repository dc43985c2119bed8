package com.meridian.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response cache statistics for the admin API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * All stored entries, including expired ones not yet cleaned up.
     */
    private long totalEntries;

    private long activeEntries;

    /**
     * Sum of persisted hit counts.
     */
    private long totalHits;

    /**
     * Hits and misses observed by this node since startup.
     */
    private long sessionHits;

    private long sessionMisses;

    /**
     * Cache hit rate (0.0-1.0) over the session counters.
     */
    private double hitRate;

    /**
     * Estimated cost saved by serving from cache, in USD.
     */
    private double costSavedUsd;

    private List<ModelStatistics> byModel;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelStatistics {
        private String provider;
        private String model;
        private long entries;
        private long hits;
    }
}
