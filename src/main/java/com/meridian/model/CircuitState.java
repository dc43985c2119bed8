package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Circuit breaker view of one provider/model.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class CircuitState {

    String provider;

    String model;

    CircuitStatus status;

    double baselineLatency;

    double baselineErrorRate;

    double currentLatency;

    double currentErrorRate;

    double latencyDeviation;

    double errorDeviation;

    /**
     * Larger of the two deviations.
     */
    double deviation;

    long windowSamples;

    /**
     * When the circuit last went CRITICAL, null if it never has.
     */
    Instant openedAt;

    /**
     * Samples recorded before this instant no longer count toward evaluation. Set on a trip and on reset.
     */
    Instant samplesSince;

    Instant updatedAt;

    public static CircuitState healthy(String provider, String model, Instant now) {
        return CircuitState.builder()
                .provider(provider)
                .model(model)
                .status(CircuitStatus.HEALTHY)
                .updatedAt(now)
                .build();
    }
}
