package com.meridian.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one adaptation pass over live telemetry.
 *
 * <p>Alpha adjustments are applied; provider disablements and enablements are recommendations
 * for policy owners and never change a stored policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptationResult {

    private Instant timestamp;

    private List<AlphaAdjustment> alphaAdjustments;

    private List<ProviderChange> providerDisablements;

    private List<ProviderChange> providerEnablements;

    private List<String> recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AlphaAdjustment {
        private String provider;
        private String model;
        private double oldAlpha;
        private double newAlpha;
        private double variance;
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderChange {
        private String provider;
        private double errorRate;
        private long requests;
        private double threshold;
        private String reason;
    }
}
