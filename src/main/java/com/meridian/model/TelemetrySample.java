package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One completed provider call.
 */
@Value
@Builder
@AllArgsConstructor
public class TelemetrySample {

    String provider;

    String model;

    Instant timestamp;

    double latencyMs;

    boolean success;

    double costUsd;

    public String key() {
        return provider + ":" + model;
    }
}
