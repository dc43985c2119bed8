package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Aggregated telemetry for one provider/model and one period bucket.
 */
@Value
@Builder
@AllArgsConstructor
public class AggregatedMetric {

    String provider;

    String model;

    Granularity granularity;

    Instant periodStart;

    double avgLatencyMs;

    double errorRate;

    double avgCostPerRequest;

    long totalRequests;

    double successRate;

    double totalCostUsd;
}
