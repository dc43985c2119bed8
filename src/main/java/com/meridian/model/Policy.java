package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guardrail configuration for one organization.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Policy {

    private String organizationId;

    private boolean trial;

    private double maxDailyCostUsd;

    private double maxRequestCostUsd;

    private int maxTokensInput;

    private int maxTokensOutput;

    private int maxConcurrentJobs;

    @Builder.Default
    private List<String> allowedProviders = new ArrayList<>();

    /**
     * Requests allowed per burst window.
     */
    private int burstRateLimit;

    /**
     * Requests allowed per sustained window.
     */
    private int sustainedRateLimit;

    /**
     * Keyed by task category id (e.g. "drafting-short").
     */
    @Builder.Default
    private Map<String, TaskOverride> taskOverrides = new HashMap<>();

    public Optional<TaskOverride> overrideFor(TaskCategory category) {
        if (taskOverrides == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(taskOverrides.get(category.getId()));
    }

    public boolean allowsProvider(String provider) {
        return allowedProviders != null && allowedProviders.contains(provider);
    }
}
