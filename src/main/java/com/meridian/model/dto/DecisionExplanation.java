package com.meridian.model.dto;

import com.meridian.model.CostEfficiency;
import com.meridian.model.DecisionFactor;
import com.meridian.model.RoutingDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A logged decision with a readable summary and derived insights.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionExplanation {

    private RoutingDecision decision;

    private String explanation;

    private Insights insights;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Insights {
        private DecisionFactor primaryFactor;
        private CostEfficiency costEfficiency;
        private int alternativesConsidered;
        private int modelsFiltered;
        private boolean budgetConstrained;
    }
}
