package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of the provider call made by the caller after a routing decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeReport {

    private String reservationId;

    private String provider;

    private String model;

    /**
     * Null when the provider did not report a cost (e.g. timeout); the estimate is used instead.
     */
    private Double actualCostUsd;

    private long actualLatencyMs;

    private boolean success;

    private boolean timedOut;

    private Integer actualTokensIn;

    private Integer actualTokensOut;

    /**
     * Completion to store in the response cache, if any.
     */
    private String completion;
}
