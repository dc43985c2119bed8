package com.meridian.service;

import com.meridian.config.CacheConfiguration;
import com.meridian.config.MeridianProperties;
import com.meridian.entity.PolicyEntity;
import com.meridian.exception.InvalidPolicyException;
import com.meridian.exception.PolicyNotFoundException;
import com.meridian.model.Policy;
import com.meridian.model.TaskCategory;
import com.meridian.model.TaskOverride;
import com.meridian.repository.PolicyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-organization guardrail configuration.
 *
 * Reads go through the policy cache; every write evicts the organization's entry.
 * Trial organizations are clamped to the trial ceilings on read, whatever is stored.
 */
@Slf4j
@Service
public class PolicyStore {

    private final PolicyRepository repository;
    private final Cache cache;
    private final MeridianProperties properties;

    public PolicyStore(PolicyRepository repository, CacheManager cacheManager, MeridianProperties properties) {
        this.repository = repository;
        this.cache = Objects.requireNonNull(cacheManager.getCache(CacheConfiguration.POLICY_CACHE),
                "policy cache not configured");
        this.properties = properties;
    }

    /**
     * Get the effective policy for an organization.
     *
     * @throws PolicyNotFoundException if none is configured
     */
    public Policy getPolicy(String organizationId) {
        Policy stored = cache.get(organizationId, Policy.class);
        if (stored == null) {
            stored = repository.findById(organizationId)
                    .map(PolicyStore::toPolicy)
                    .orElseThrow(() -> new PolicyNotFoundException(organizationId));
            cache.put(organizationId, stored);
        }
        return applyTrialRestrictions(stored);
    }

    /**
     * Validate and save a policy.
     *
     * @throws InvalidPolicyException listing every violated field
     */
    @Transactional
    public Policy upsertPolicy(String organizationId, Policy policy) {
        List<String> violations = validate(policy);
        if (!violations.isEmpty()) {
            throw new InvalidPolicyException(organizationId, violations);
        }

        Policy normalized = policy.toBuilder().organizationId(organizationId).build();
        PolicyEntity entity = repository.findById(organizationId).orElseGet(PolicyEntity::new);
        copyToEntity(normalized, entity);
        repository.save(entity);
        cache.evict(organizationId);

        log.info("Saved policy for org={} trial={} maxDailyCostUsd={} allowedProviders={}",
                organizationId, policy.isTrial(), policy.getMaxDailyCostUsd(), policy.getAllowedProviders());
        return applyTrialRestrictions(normalized);
    }

    @Transactional
    public void deletePolicy(String organizationId) {
        if (!repository.existsById(organizationId)) {
            throw new PolicyNotFoundException(organizationId);
        }
        repository.deleteById(organizationId);
        cache.evict(organizationId);
        log.info("Deleted policy for org={}", organizationId);
    }

    public List<Policy> listPolicies() {
        return repository.findAll().stream()
                .map(PolicyStore::toPolicy)
                .map(this::applyTrialRestrictions)
                .toList();
    }

    /**
     * Check policy invariants.
     *
     * @return violated fields with a short description, empty when valid
     */
    public List<String> validate(Policy policy) {
        List<String> violations = new ArrayList<>();
        if (policy == null) {
            violations.add("policy: must be provided");
            return violations;
        }

        if (policy.getMaxDailyCostUsd() <= 0) {
            violations.add("maxDailyCostUsd: must be positive");
        }
        if (policy.getMaxRequestCostUsd() <= 0) {
            violations.add("maxRequestCostUsd: must be positive");
        }
        if (policy.getMaxRequestCostUsd() > policy.getMaxDailyCostUsd()) {
            violations.add("maxRequestCostUsd: must not exceed maxDailyCostUsd");
        }
        if (policy.getMaxTokensInput() <= 0) {
            violations.add("maxTokensInput: must be positive");
        }
        if (policy.getMaxTokensOutput() <= 0) {
            violations.add("maxTokensOutput: must be positive");
        }
        if (policy.getMaxConcurrentJobs() <= 0) {
            violations.add("maxConcurrentJobs: must be positive");
        }
        if (policy.getBurstRateLimit() <= 0) {
            violations.add("burstRateLimit: must be a positive integer");
        }
        if (policy.getSustainedRateLimit() <= 0) {
            violations.add("sustainedRateLimit: must be a positive integer");
        }
        if (policy.getAllowedProviders() == null || policy.getAllowedProviders().isEmpty()) {
            violations.add("allowedProviders: must not be empty");
        }

        if (policy.getTaskOverrides() != null) {
            policy.getTaskOverrides().forEach((category, override) -> validateOverride(category, override, violations));
        }
        return violations;
    }

    private static void validateOverride(String category, TaskOverride override, List<String> violations) {
        String field = "taskOverrides." + category;
        try {
            TaskCategory.fromId(category);
        } catch (IllegalArgumentException e) {
            violations.add(field + ": unknown task category");
        }
        if (override == null) {
            violations.add(field + ": must not be null");
            return;
        }
        if (override.getMinPerf() != null && (override.getMinPerf() < 0.0 || override.getMinPerf() > 1.0)) {
            violations.add(field + ".minPerf: must be within [0,1]");
        }
        if (override.getMaxCost() != null && override.getMaxCost() <= 0) {
            violations.add(field + ".maxCost: must be positive");
        }
    }

    /**
     * Cap a trial organization's limits at the configured trial ceilings.
     */
    Policy applyTrialRestrictions(Policy policy) {
        if (!policy.isTrial()) {
            return policy;
        }
        MeridianProperties.TrialConfig trial = properties.getPolicy().getTrial();
        return policy.toBuilder()
                .maxDailyCostUsd(Math.min(policy.getMaxDailyCostUsd(), trial.getMaxDailyCostUsd()))
                .maxRequestCostUsd(Math.min(policy.getMaxRequestCostUsd(), trial.getMaxRequestCostUsd()))
                .maxConcurrentJobs(Math.min(policy.getMaxConcurrentJobs(), trial.getMaxConcurrentJobs()))
                .burstRateLimit(Math.min(policy.getBurstRateLimit(), trial.getBurstRateLimit()))
                .sustainedRateLimit(Math.min(policy.getSustainedRateLimit(), trial.getSustainedRateLimit()))
                .build();
    }

    private static Policy toPolicy(PolicyEntity entity) {
        return Policy.builder()
                .organizationId(entity.getOrganizationId())
                .trial(entity.isTrial())
                .maxDailyCostUsd(entity.getMaxDailyCostUsd())
                .maxRequestCostUsd(entity.getMaxRequestCostUsd())
                .maxTokensInput(entity.getMaxTokensInput())
                .maxTokensOutput(entity.getMaxTokensOutput())
                .maxConcurrentJobs(entity.getMaxConcurrentJobs())
                .allowedProviders(entity.getAllowedProviders() != null
                        ? new ArrayList<>(entity.getAllowedProviders()) : new ArrayList<>())
                .burstRateLimit(entity.getBurstRateLimit())
                .sustainedRateLimit(entity.getSustainedRateLimit())
                .taskOverrides(entity.getTaskOverrides() != null
                        ? new HashMap<>(entity.getTaskOverrides()) : new HashMap<>())
                .build();
    }

    private static void copyToEntity(Policy policy, PolicyEntity entity) {
        entity.setOrganizationId(policy.getOrganizationId());
        entity.setTrial(policy.isTrial());
        entity.setMaxDailyCostUsd(policy.getMaxDailyCostUsd());
        entity.setMaxRequestCostUsd(policy.getMaxRequestCostUsd());
        entity.setMaxTokensInput(policy.getMaxTokensInput());
        entity.setMaxTokensOutput(policy.getMaxTokensOutput());
        entity.setMaxConcurrentJobs(policy.getMaxConcurrentJobs());
        entity.setAllowedProviders(new ArrayList<>(policy.getAllowedProviders()));
        entity.setBurstRateLimit(policy.getBurstRateLimit());
        entity.setSustainedRateLimit(policy.getSustainedRateLimit());
        Map<String, TaskOverride> overrides = policy.getTaskOverrides();
        entity.setTaskOverrides(overrides != null ? new HashMap<>(overrides) : new HashMap<>());
    }
}
