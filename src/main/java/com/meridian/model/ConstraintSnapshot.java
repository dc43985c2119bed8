package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective constraints a decision was made under.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintSnapshot {

    private double minPerformance;

    /**
     * Null when uncapped.
     */
    private Double maxCost;

    @Builder.Default
    private List<String> allowedProviders = new ArrayList<>();

    private boolean forceCheapest;
}
