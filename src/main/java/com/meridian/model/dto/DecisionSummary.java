package com.meridian.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over an organization's decisions in a period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionSummary {

    private String organizationId;

    private Instant from;

    private Instant to;

    private long totalDecisions;

    /**
     * Keyed by "provider:model".
     */
    private Map<String, Long> byModel;

    /**
     * Keyed by task category id.
     */
    private Map<String, Long> byTaskCategory;

    private double avgCost;

    private long forceCheapestCount;

    private double forceCheapestPercent;

    private long cacheHits;

    /**
     * Decisions whose caller timed out; excluded from every other figure.
     */
    private long abandonedDecisions;

    private List<ModelUsage> topModels;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelUsage {
        private String provider;
        private String model;
        private long count;
        private double avgCost;
        private Instant lastUsed;
    }
}
