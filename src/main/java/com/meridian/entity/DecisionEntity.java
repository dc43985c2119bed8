package com.meridian.entity;

import com.meridian.model.Alternative;
import com.meridian.model.ConstraintSnapshot;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TelemetrySnapshot;
import com.meridian.repository.converter.AlternativesConverter;
import com.meridian.repository.converter.ConstraintSnapshotConverter;
import com.meridian.repository.converter.ScoreFactorsConverter;
import com.meridian.repository.converter.TelemetrySnapshotConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * JPA entity for the routing_decisions table. Rows are inserted once; only the abandoned flag
 * changes afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "routing_decisions", indexes = {
        @Index(name = "idx_decision_org_created", columnList = "organization_id, created_at"),
        @Index(name = "idx_decision_org_category", columnList = "organization_id, task_category"),
        @Index(name = "idx_decision_org_provider", columnList = "organization_id, provider")
})
public class DecisionEntity {

    @Id
    @Column(name = "decision_id", length = 36)
    private String decisionId;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "reservation_id", length = 36)
    private String reservationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "task_category", nullable = false, length = 32)
    private String taskCategory;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Column(name = "estimated_cost", nullable = false)
    private double estimatedCost;

    @Column(name = "total_score")
    private double totalScore;

    @Column(name = "budget_status", length = 16)
    private String budgetStatus;

    @Column(name = "force_cheapest", nullable = false)
    private boolean forceCheapest;

    @Column(name = "cache_hit", nullable = false)
    private boolean cacheHit;

    @Column(name = "abandoned", nullable = false)
    private boolean abandoned;

    @Column(name = "cache_key", length = 64)
    private String cacheKey;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Convert(converter = ScoreFactorsConverter.class)
    @Column(name = "factors", columnDefinition = "TEXT", updatable = false)
    private ScoreFactors factors;

    @Convert(converter = AlternativesConverter.class)
    @Column(name = "alternatives", columnDefinition = "TEXT", updatable = false)
    private List<Alternative> alternatives;

    @Convert(converter = ConstraintSnapshotConverter.class)
    @Column(name = "constraint_snapshot", columnDefinition = "TEXT", updatable = false)
    private ConstraintSnapshot constraints;

    @Convert(converter = TelemetrySnapshotConverter.class)
    @Column(name = "telemetry_snapshot", columnDefinition = "TEXT", updatable = false)
    private TelemetrySnapshot telemetry;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
