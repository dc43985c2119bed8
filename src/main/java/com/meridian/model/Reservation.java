package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Budget held for an admitted request until its outcome is committed or released.
 *
 * <p>Once a model has been selected the reservation also carries the route, so that any node
 * receiving the outcome report can reconcile it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
public class Reservation {

    String id;

    String organizationId;

    /**
     * UTC day whose counters were debited.
     */
    LocalDate day;

    double estimatedCost;

    Instant createdAt;

    /**
     * Budget status after the reservation was taken.
     */
    BudgetStatus budgetStatus;

    String decisionId;

    String provider;

    String model;

    String cacheKey;

    public Reservation withEstimate(double newEstimate, BudgetStatus newStatus) {
        return toBuilder().estimatedCost(newEstimate).budgetStatus(newStatus).build();
    }

    public Reservation withRoute(String decisionId, String provider, String model, String cacheKey) {
        return toBuilder().decisionId(decisionId).provider(provider).model(model).cacheKey(cacheKey).build();
    }

    @JsonIgnore
    public boolean isRouted() {
        return provider != null && model != null;
    }
}
