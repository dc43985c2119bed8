package com.meridian.model.dto;

import com.meridian.model.Trend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Telemetry rollup over a period, with first-half vs second-half trends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetrySummary {

    private Instant from;

    private Instant to;

    private long totalRequests;

    private double avgLatencyMs;

    private double errorRate;

    private double totalCostUsd;

    private Trend latencyTrend;

    private Trend errorRateTrend;

    private Trend costTrend;

    private List<ModelSummary> byModel;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelSummary {
        private String provider;
        private String model;
        private long requests;
        private double avgLatencyMs;
        private double errorRate;
        private double totalCostUsd;
    }
}
