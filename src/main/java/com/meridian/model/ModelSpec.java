package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Catalog entry for a routable provider/model pair.
 */
@Value
@Builder
@AllArgsConstructor
public class ModelSpec {

    private static final double TOKENS_PER_PRICE_UNIT = 1_000_000.0;

    String provider;

    String model;

    double inputPricePerMillion;

    double outputPricePerMillion;

    /**
     * Static capability rating in [0,1].
     */
    double quality;

    Map<TaskCategory, Double> categoryQuality;

    /**
     * Categories the model is registered for. Empty means all.
     */
    Set<TaskCategory> taskCategories;

    public String key() {
        return provider + ":" + model;
    }

    public double estimateCost(int tokensIn, int tokensOut) {
        return tokensIn / TOKENS_PER_PRICE_UNIT * inputPricePerMillion
                + tokensOut / TOKENS_PER_PRICE_UNIT * outputPricePerMillion;
    }

    public double qualityFor(TaskCategory category) {
        if (categoryQuality != null && categoryQuality.containsKey(category)) {
            return categoryQuality.get(category);
        }
        return quality;
    }

    public boolean supports(TaskCategory category) {
        return taskCategories == null || taskCategories.isEmpty() || taskCategories.contains(category);
    }
}
