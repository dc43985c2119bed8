package com.meridian.support;

import com.meridian.model.Policy;
import com.meridian.model.TaskOverride;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final String ORG = "org-acme";

    private Fixtures() {
    }

    public static Policy.PolicyBuilder policy() {
        return Policy.builder()
                .organizationId(ORG)
                .trial(false)
                .maxDailyCostUsd(10.0)
                .maxRequestCostUsd(1.0)
                .maxTokensInput(100_000)
                .maxTokensOutput(16_000)
                .maxConcurrentJobs(10)
                .allowedProviders(new ArrayList<>(List.of("openai", "anthropic")))
                .burstRateLimit(100)
                .sustainedRateLimit(1000)
                .taskOverrides(new HashMap<>());
    }

    public static Map<String, TaskOverride> draftingShortOverride() {
        Map<String, TaskOverride> overrides = new HashMap<>();
        overrides.put("drafting-short", TaskOverride.builder()
                .minPerf(0.5)
                .preferredModels(List.of("gpt-4o-mini", "claude-3-haiku"))
                .build());
        return overrides;
    }
}
