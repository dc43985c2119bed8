package com.meridian.entity;

import com.meridian.model.TaskOverride;
import com.meridian.repository.converter.StringListConverter;
import com.meridian.repository.converter.TaskOverridesConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JPA entity for the ai_policies table. One row per organization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "ai_policies")
public class PolicyEntity {

    @Id
    @Column(name = "organization_id", length = 64)
    private String organizationId;

    @Column(name = "trial", nullable = false)
    private boolean trial;

    @Column(name = "max_daily_cost_usd", nullable = false)
    private double maxDailyCostUsd;

    @Column(name = "max_request_cost_usd", nullable = false)
    private double maxRequestCostUsd;

    @Column(name = "max_tokens_input", nullable = false)
    private int maxTokensInput;

    @Column(name = "max_tokens_output", nullable = false)
    private int maxTokensOutput;

    @Column(name = "max_concurrent_jobs", nullable = false)
    private int maxConcurrentJobs;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_providers", nullable = false, columnDefinition = "TEXT")
    private List<String> allowedProviders;

    @Column(name = "burst_rate_limit", nullable = false)
    private int burstRateLimit;

    @Column(name = "sustained_rate_limit", nullable = false)
    private int sustainedRateLimit;

    @Convert(converter = TaskOverridesConverter.class)
    @Column(name = "task_overrides", columnDefinition = "TEXT")
    private Map<String, TaskOverride> taskOverrides;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
