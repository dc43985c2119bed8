package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inbound request for an admission and model selection decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRequest {

    private String organizationId;

    private TaskCategory taskCategory;

    private int estimatedTokensIn;

    private int estimatedTokensOut;

    /**
     * Optional caller estimate. When absent the cheapest eligible model's cost is used for admission.
     */
    private Double estimatedCostUsd;

    private CallerConstraints constraints;

    /**
     * Prompt text, only needed for response cache lookups.
     */
    private String prompt;

    /**
     * Generation parameters that affect the completion (temperature, max_tokens, ...).
     */
    private Map<String, Object> parameters;
}
