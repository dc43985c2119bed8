package com.meridian.service.routing;

import com.meridian.model.CircuitStatus;
import com.meridian.model.ModelSpec;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TelemetrySnapshot;

/**
 * An eligible candidate with its score breakdown.
 *
 * @param spec          catalog entry
 * @param estimatedCost cost for the request's token counts
 * @param factors       normalized sub-scores and total (after penalty and bonus)
 * @param telemetry     telemetry used for the latency and error scores
 * @param preferred     listed in the category's preferred models
 */
public record ScoredCandidate(
        ModelSpec spec,
        double estimatedCost,
        ScoreFactors factors,
        TelemetrySnapshot telemetry,
        boolean preferred) {

    public String key() {
        return spec.key();
    }

    public double totalScore() {
        return factors.getTotalScore();
    }

    public CircuitStatus circuitStatus() {
        return telemetry != null ? telemetry.getCircuitStatus() : CircuitStatus.HEALTHY;
    }
}
