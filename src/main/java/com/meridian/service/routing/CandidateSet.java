package com.meridian.service.routing;

import com.meridian.model.Alternative;
import com.meridian.model.ConstraintSnapshot;
import com.meridian.model.ModelSpec;
import com.meridian.model.TaskCategory;

import java.util.List;

/**
 * Candidates for one request after provider, circuit, quality and cost filtering.
 *
 * @param category        task category
 * @param tokensIn        estimated input tokens
 * @param tokensOut       estimated output tokens
 * @param eligible        candidates that passed every filter, preferred models first, then by key
 * @param rejected        filtered candidates with their reasons
 * @param constraints     effective constraints (forceCheapest not yet decided)
 * @param preferredModels preferred model names from the category override
 * @param cheapestAllowedCost lowest cost among the category's models from allowed providers,
 *                        before circuit, quality and cost filtering; 0 when there are none
 */
public record CandidateSet(
        TaskCategory category,
        int tokensIn,
        int tokensOut,
        List<ModelSpec> eligible,
        List<Alternative> rejected,
        ConstraintSnapshot constraints,
        List<String> preferredModels,
        double cheapestAllowedCost) {

    public boolean isEmpty() {
        return eligible.isEmpty();
    }

    public double costOf(ModelSpec spec) {
        return spec.estimateCost(tokensIn, tokensOut);
    }
}
