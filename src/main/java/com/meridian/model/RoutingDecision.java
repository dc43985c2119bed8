package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a routing request. Also the immutable record kept in the decision log.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {

    private String decisionId;

    private String reservationId;

    private String organizationId;

    private Instant timestamp;

    private TaskCategory taskCategory;

    private String provider;

    private String model;

    private double estimatedCost;

    private ScoreFactors factors;

    @Builder.Default
    private List<Alternative> alternatives = new ArrayList<>();

    private ConstraintSnapshot constraints;

    private TelemetrySnapshot telemetry;

    private BudgetStatus budgetStatus;

    private boolean forceCheapest;

    private boolean cacheHit;

    /**
     * Set when the caller gave up before receiving the decision; its reservation was released.
     */
    private boolean abandoned;

    private String cacheKey;

    private String cachedCompletion;

    private String reason;
}
