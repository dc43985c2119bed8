package com.meridian.service.routing;

import com.meridian.model.Alternative;
import com.meridian.model.ConstraintSnapshot;

import java.util.List;

/**
 * Outcome of model selection.
 *
 * @param selected     winning candidate
 * @param alternatives every other candidate, eligible ones by score then rejected ones
 * @param constraints  constraints in force, including forceCheapest
 * @param reason       one-line rationale
 */
public record Selection(
        ScoredCandidate selected,
        List<Alternative> alternatives,
        ConstraintSnapshot constraints,
        String reason) {
}
