package com.meridian.model.dto;

import com.meridian.model.RateLimitStatus;
import com.meridian.model.UsageSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Budget and rate usage for one organization, served by the admin usage endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuardrailStatus {

    private UsageSnapshot usage;

    private RateLimitStatus rate;

    private boolean trial;
}
