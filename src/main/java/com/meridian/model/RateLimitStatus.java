package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current rate window usage for an organization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {

    private String organizationId;

    private long burstCount;

    private int burstLimit;

    private long burstResetMs;

    private long sustainedCount;

    private int sustainedLimit;

    private long sustainedResetMs;
}
