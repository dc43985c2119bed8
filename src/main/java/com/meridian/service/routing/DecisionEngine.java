package com.meridian.service.routing;

import com.meridian.exception.NoEligibleModelException;
import com.meridian.model.Alternative;
import com.meridian.model.CallerConstraints;
import com.meridian.model.ConstraintSnapshot;
import com.meridian.model.ModelSpec;
import com.meridian.model.Policy;
import com.meridian.model.RejectReason;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TaskCategory;
import com.meridian.model.TaskOverride;
import com.meridian.service.ModelCatalog;
import com.meridian.service.telemetry.CircuitBreakerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Model selection for admitted requests.
 *
 * Flow:
 * 1. Build candidates: catalog models for the category, filtered by allowed providers,
 *    open circuits, minimum quality and maximum cost (each rejection recorded with its reason)
 * 2. Force-cheapest: lowest cost eligible candidate wins, no scoring
 * 3. Otherwise highest total score wins; ties by lower cost, then provider/model key
 *
 * No randomness: identical policy, telemetry and circuit state give identical results.
 */
@Slf4j
@Service
public class DecisionEngine {

    private static final Comparator<ScoredCandidate> BY_SCORE = Comparator
            .comparingDouble(ScoredCandidate::totalScore).reversed()
            .thenComparingDouble(ScoredCandidate::estimatedCost)
            .thenComparing(ScoredCandidate::key);

    private static final Comparator<ScoredCandidate> BY_COST = Comparator
            .comparingDouble(ScoredCandidate::estimatedCost)
            .thenComparing(ScoredCandidate::key);

    private final ModelCatalog catalog;
    private final CircuitBreakerService circuitBreaker;
    private final CandidateScorer scorer;

    public DecisionEngine(ModelCatalog catalog, CircuitBreakerService circuitBreaker, CandidateScorer scorer) {
        this.catalog = catalog;
        this.circuitBreaker = circuitBreaker;
        this.scorer = scorer;
    }

    /**
     * Build and filter the candidate set. An empty set is returned as is so that admission can
     * run first; see {@link #requireEligible}.
     */
    public CandidateSet candidates(Policy policy, TaskCategory category, int tokensIn, int tokensOut,
                                   CallerConstraints caller) {
        ConstraintSnapshot constraints = effectiveConstraints(policy, category, caller);
        List<String> preferred = policy.overrideFor(category)
                .map(TaskOverride::getPreferredModels)
                .orElse(List.of());

        List<ModelSpec> eligible = new ArrayList<>();
        List<Alternative> rejected = new ArrayList<>();
        double cheapestAllowed = Double.MAX_VALUE;

        for (ModelSpec spec : catalog.modelsFor(category)) {
            double cost = spec.estimateCost(tokensIn, tokensOut);
            if (policy.allowsProvider(spec.getProvider())) {
                cheapestAllowed = Math.min(cheapestAllowed, cost);
            }
            RejectReason reason = rejectReason(spec, category, cost, policy, constraints);
            if (reason != null) {
                log.debug("Rejected {} for {}: {}", spec.key(), category, reason);
                rejected.add(Alternative.builder()
                        .provider(spec.getProvider())
                        .model(spec.getModel())
                        .score(0.0)
                        .estimatedCost(cost)
                        .rejected(true)
                        .rejectReason(reason)
                        .build());
            } else {
                eligible.add(spec);
            }
        }

        eligible.sort(Comparator
                .comparing((ModelSpec spec) -> preferenceRank(preferred, spec))
                .thenComparing(ModelSpec::key));

        return new CandidateSet(category, tokensIn, tokensOut,
                List.copyOf(eligible), List.copyOf(rejected), constraints,
                preferred != null ? List.copyOf(preferred) : List.of(),
                cheapestAllowed == Double.MAX_VALUE ? 0.0 : cheapestAllowed);
    }

    /**
     * @throws NoEligibleModelException when every candidate was filtered out
     */
    public CandidateSet requireEligible(Policy policy, CandidateSet candidates) {
        if (candidates.isEmpty()) {
            log.warn("No eligible model for org={} category={}: {} candidates rejected",
                    policy.getOrganizationId(), candidates.category(), candidates.rejected().size());
            throw new NoEligibleModelException(candidates.category(), candidates.rejected());
        }
        return candidates;
    }

    /**
     * Select among an already filtered, non-empty candidate set. Force-cheapest skips scoring
     * and only reads telemetry for the winner.
     */
    public Selection select(CandidateSet candidates, boolean forceCheapest) {
        List<ScoredCandidate> ranked;
        ScoredCandidate selected;
        String reason;

        if (forceCheapest) {
            List<ModelSpec> byCost = new ArrayList<>(candidates.eligible());
            byCost.sort(Comparator.comparingDouble(candidates::costOf).thenComparing(ModelSpec::key));
            ranked = new ArrayList<>(byCost.size());
            for (ModelSpec spec : byCost) {
                boolean preferred = candidates.preferredModels().contains(spec.getModel());
                ranked.add(new ScoredCandidate(spec, candidates.costOf(spec), ScoreFactors.zero(),
                        ranked.isEmpty() ? scorer.snapshot(spec) : null, preferred));
            }
            selected = ranked.get(0);
            reason = String.format("Forced cheapest: %s at $%.6f is the lowest-cost model meeting minimum performance %.2f",
                    selected.key(), selected.estimatedCost(), candidates.constraints().getMinPerformance());
        } else {
            ranked = new ArrayList<>(scorer.score(candidates));
            ranked.sort(BY_SCORE);
            selected = ranked.get(0);
            reason = String.format("Selected %s with total score %.4f (cost %.2f, latency %.2f, error %.2f, quality %.2f) among %d eligible models%s",
                    selected.key(), selected.totalScore(),
                    selected.factors().getCostScore(), selected.factors().getLatencyScore(),
                    selected.factors().getErrorScore(), selected.factors().getQualityScore(),
                    ranked.size(), selected.preferred() ? ", preferred for this task" : "");
        }

        List<Alternative> alternatives = new ArrayList<>();
        ranked.stream()
                .filter(candidate -> candidate != selected)
                .sorted(forceCheapest ? BY_COST : BY_SCORE)
                .forEach(candidate -> alternatives.add(Alternative.builder()
                        .provider(candidate.spec().getProvider())
                        .model(candidate.spec().getModel())
                        .score(candidate.totalScore())
                        .estimatedCost(candidate.estimatedCost())
                        .rejected(false)
                        .build()));
        alternatives.addAll(candidates.rejected());

        ConstraintSnapshot constraints = candidates.constraints().toBuilder()
                .forceCheapest(forceCheapest)
                .build();

        log.debug("Selected {} for {} (forceCheapest={})", selected.key(), candidates.category(), forceCheapest);
        return new Selection(selected, alternatives, constraints, reason);
    }

    /**
     * Category default or override for minimum quality, raised by the caller; maximum cost is
     * the tightest of override, caller and the policy's per-request cap.
     */
    ConstraintSnapshot effectiveConstraints(Policy policy, TaskCategory category, CallerConstraints caller) {
        TaskOverride override = policy.overrideFor(category).orElse(null);

        double minPerf = override != null && override.getMinPerf() != null
                ? override.getMinPerf()
                : category.getDefaultMinPerf();
        if (caller != null && caller.getMinPerf() != null) {
            minPerf = Math.max(minPerf, caller.getMinPerf());
        }

        double maxCost = policy.getMaxRequestCostUsd();
        if (override != null && override.getMaxCost() != null) {
            maxCost = Math.min(maxCost, override.getMaxCost());
        }
        if (caller != null && caller.getMaxCost() != null) {
            maxCost = Math.min(maxCost, caller.getMaxCost());
        }

        return ConstraintSnapshot.builder()
                .minPerformance(minPerf)
                .maxCost(maxCost)
                .allowedProviders(List.copyOf(policy.getAllowedProviders()))
                .forceCheapest(false)
                .build();
    }

    private RejectReason rejectReason(ModelSpec spec, TaskCategory category, double cost,
                                      Policy policy, ConstraintSnapshot constraints) {
        if (!policy.allowsProvider(spec.getProvider())) {
            return RejectReason.PROVIDER_NOT_ALLOWED;
        }
        if (circuitBreaker.isOpen(spec.getProvider(), spec.getModel())) {
            return RejectReason.CIRCUIT_OPEN;
        }
        if (spec.qualityFor(category) < constraints.getMinPerformance()) {
            return RejectReason.BELOW_MIN_PERFORMANCE;
        }
        if (constraints.getMaxCost() != null && cost > constraints.getMaxCost()) {
            return RejectReason.EXCEEDS_MAX_COST;
        }
        return null;
    }

    private static int preferenceRank(List<String> preferred, ModelSpec spec) {
        int index = preferred == null ? -1 : preferred.indexOf(spec.getModel());
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
