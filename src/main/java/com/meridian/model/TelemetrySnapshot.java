package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Near-real-time health of one provider/model, as seen by the scorer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetrySnapshot {

    private String provider;

    private String model;

    private double latencyMs;

    /**
     * Exponentially weighted latency over every sample seen, using the model's current alpha.
     */
    private double smoothedLatencyMs;

    private double errorRate;

    private long requestCount;

    private double avgCostUsd;

    private CircuitStatus circuitStatus;
}
