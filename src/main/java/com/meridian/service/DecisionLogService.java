package com.meridian.service;

import com.meridian.entity.DecisionEntity;
import com.meridian.exception.DecisionNotFoundException;
import com.meridian.model.Alternative;
import com.meridian.model.BudgetStatus;
import com.meridian.model.ConstraintSnapshot;
import com.meridian.model.CostEfficiency;
import com.meridian.model.DecisionFactor;
import com.meridian.model.DecisionFilter;
import com.meridian.model.RoutingDecision;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TaskCategory;
import com.meridian.model.TelemetrySnapshot;
import com.meridian.model.dto.DecisionExplanation;
import com.meridian.model.dto.DecisionSummary;
import com.meridian.repository.DecisionRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only log of routing decisions with history, explanation and summary queries.
 */
@Slf4j
@Service
public class DecisionLogService {

    private static final int EXPLAIN_ALTERNATIVES = 5;
    private static final int TOP_MODELS = 5;
    private static final double SIMILAR_SCORE = 0.1;

    private final DecisionRepository repository;

    public DecisionLogService(DecisionRepository repository) {
        this.repository = repository;
    }

    /**
     * Persist a decision. Apart from {@link #markAbandoned} decisions are never updated afterwards.
     */
    @Transactional
    public RoutingDecision record(RoutingDecision decision) {
        if (repository.existsById(decision.getDecisionId())) {
            throw new IllegalStateException("Decision already recorded: " + decision.getDecisionId());
        }
        repository.save(toEntity(decision));
        log.info("Decision {} org={} category={} selected={}:{} cost=${} forceCheapest={} cacheHit={}",
                decision.getDecisionId(), decision.getOrganizationId(), decision.getTaskCategory(),
                decision.getProvider(), decision.getModel(), decision.getEstimatedCost(),
                decision.isForceCheapest(), decision.isCacheHit());
        return decision;
    }

    /**
     * Flag a decision whose caller timed out before receiving it.
     *
     * @return false if the decision is unknown
     */
    @Transactional
    public boolean markAbandoned(String decisionId) {
        return repository.findById(decisionId)
                .map(entity -> {
                    entity.setAbandoned(true);
                    repository.save(entity);
                    log.warn("Decision {} org={} abandoned by its caller", decisionId, entity.getOrganizationId());
                    return true;
                })
                .orElse(false);
    }

    public RoutingDecision get(String decisionId) {
        return repository.findById(decisionId)
                .map(DecisionLogService::toDecision)
                .orElseThrow(() -> new DecisionNotFoundException(decisionId));
    }

    /**
     * Decisions of an organization, newest first.
     */
    public List<RoutingDecision> getHistory(String organizationId, DecisionFilter filter) {
        DecisionFilter criteria = filter != null ? filter : DecisionFilter.builder().build();
        Specification<DecisionEntity> spec = buildSpecification(organizationId, criteria);
        int limit = Math.max(1, Math.min(criteria.getLimit(), 1000));

        return repository.findAll(spec, PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "createdAt")))
                .map(DecisionLogService::toDecision)
                .getContent();
    }

    public DecisionExplanation explain(String decisionId) {
        RoutingDecision decision = get(decisionId);
        return DecisionExplanation.builder()
                .decision(decision)
                .explanation(explanationText(decision))
                .insights(insights(decision))
                .build();
    }

    /**
     * Counts and averages over decisions in [from, to).
     */
    public DecisionSummary summary(String organizationId, Instant from, Instant to) {
        List<DecisionEntity> decisions = repository
                .findByOrganizationIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
                        organizationId, from, to);

        Map<String, Long> byModel = new TreeMap<>();
        Map<String, Long> byCategory = new TreeMap<>();
        Map<String, ModelTally> tallies = new LinkedHashMap<>();
        double totalCost = 0.0;
        long forced = 0;
        long cacheHits = 0;
        long abandoned = 0;
        List<DecisionEntity> served = new ArrayList<>();

        for (DecisionEntity decision : decisions) {
            if (decision.isAbandoned()) {
                abandoned++;
            } else {
                served.add(decision);
            }
        }

        for (DecisionEntity decision : served) {
            String key = decision.getProvider() + ":" + decision.getModel();
            byModel.merge(key, 1L, Long::sum);
            byCategory.merge(decision.getTaskCategory(), 1L, Long::sum);
            tallies.computeIfAbsent(key, k -> new ModelTally(decision.getProvider(), decision.getModel()))
                    .add(decision.getEstimatedCost(), decision.getCreatedAt());
            totalCost += decision.getEstimatedCost();
            if (decision.isForceCheapest()) {
                forced++;
            }
            if (decision.isCacheHit()) {
                cacheHits++;
            }
        }

        int total = served.size();
        List<DecisionSummary.ModelUsage> topModels = tallies.values().stream()
                .sorted(Comparator.comparingLong((ModelTally t) -> t.count).reversed()
                        .thenComparing(t -> t.provider + ":" + t.model))
                .limit(TOP_MODELS)
                .map(ModelTally::toUsage)
                .toList();

        return DecisionSummary.builder()
                .organizationId(organizationId)
                .from(from)
                .to(to)
                .totalDecisions(total)
                .byModel(byModel)
                .byTaskCategory(byCategory)
                .avgCost(total > 0 ? totalCost / total : 0.0)
                .forceCheapestCount(forced)
                .forceCheapestPercent(total > 0 ? forced * 100.0 / total : 0.0)
                .cacheHits(cacheHits)
                .abandonedDecisions(abandoned)
                .topModels(topModels)
                .build();
    }

    /**
     * Primary factor is the highest sub-score (earlier factor wins ties). Cost efficiency is
     * "good" when an eligible alternative scored within 0.1 of the selection, and always
     * "optimal" when the selection was forced to the cheapest model.
     */
    DecisionExplanation.Insights insights(RoutingDecision decision) {
        ScoreFactors factors = decision.getFactors() != null ? decision.getFactors() : ScoreFactors.zero();
        List<Alternative> alternatives = decision.getAlternatives() != null ? decision.getAlternatives() : List.of();

        DecisionFactor primary = DecisionFactor.COST;
        double max = factors.getCostScore();
        if (factors.getLatencyScore() > max) {
            primary = DecisionFactor.LATENCY;
            max = factors.getLatencyScore();
        }
        if (factors.getErrorScore() > max) {
            primary = DecisionFactor.ERROR;
            max = factors.getErrorScore();
        }
        if (factors.getQualityScore() > max) {
            primary = DecisionFactor.QUALITY;
        }

        boolean hasSimilar = alternatives.stream()
                .anyMatch(alt -> !alt.isRejected() && Math.abs(alt.getScore() - factors.getTotalScore()) < SIMILAR_SCORE);
        CostEfficiency efficiency = hasSimilar ? CostEfficiency.GOOD : CostEfficiency.OPTIMAL;
        if (decision.isForceCheapest()) {
            efficiency = CostEfficiency.OPTIMAL;
        }

        return DecisionExplanation.Insights.builder()
                .primaryFactor(primary)
                .costEfficiency(efficiency)
                .alternativesConsidered((int) alternatives.stream().filter(alt -> !alt.isRejected()).count())
                .modelsFiltered((int) alternatives.stream().filter(Alternative::isRejected).count())
                .budgetConstrained(decision.isForceCheapest())
                .build();
    }

    String explanationText(RoutingDecision decision) {
        ScoreFactors factors = decision.getFactors() != null ? decision.getFactors() : ScoreFactors.zero();
        List<String> lines = new ArrayList<>();

        lines.add("Decision for " + decision.getTaskCategory() + " task:");
        lines.add("Selected: " + decision.getProvider() + ":" + decision.getModel());
        lines.add(format("Cost: $%.6f", decision.getEstimatedCost()));
        if (decision.isCacheHit()) {
            lines.add("Served from response cache");
        }
        if (decision.isAbandoned()) {
            lines.add("Abandoned: the caller timed out before receiving this decision");
        }
        lines.add("");

        lines.add("Decision Factors:");
        lines.add(format("  Cost Score: %.1f%%", factors.getCostScore() * 100));
        lines.add(format("  Latency Score: %.1f%%", factors.getLatencyScore() * 100));
        lines.add(format("  Error Score: %.1f%%", factors.getErrorScore() * 100));
        lines.add(format("  Quality Score: %.1f%%", factors.getQualityScore() * 100));
        lines.add(format("  Total Score: %.4f (higher is better)", factors.getTotalScore()));
        lines.add("");

        ConstraintSnapshot constraints = decision.getConstraints();
        if (constraints != null) {
            lines.add("Policy Constraints:");
            lines.add(format("  Min Performance: %.1f%%", constraints.getMinPerformance() * 100));
            lines.add("  Allowed Providers: " + String.join(", ", constraints.getAllowedProviders()));
            if (constraints.isForceCheapest()) {
                lines.add("  FORCED CHEAPEST (budget constraint)");
            }
            if (constraints.getMaxCost() != null) {
                lines.add(format("  Max Cost: $%.4f", constraints.getMaxCost()));
            }
            lines.add("");
        }

        List<Alternative> alternatives = decision.getAlternatives();
        if (alternatives != null && !alternatives.isEmpty()) {
            lines.add("Alternatives Considered (" + alternatives.size() + "):");
            for (Alternative alt : alternatives.subList(0, Math.min(EXPLAIN_ALTERNATIVES, alternatives.size()))) {
                String status = alt.isRejected() ? "rejected: " + alt.getRejectReason() : "eligible";
                lines.add(format("  [%s] %s (score: %.4f)", status, alt.key(), alt.getScore()));
            }
            lines.add("");
        }

        TelemetrySnapshot telemetry = decision.getTelemetry();
        if (telemetry != null) {
            lines.add("Performance Telemetry:");
            lines.add(format("  Latency: %.0fms", telemetry.getLatencyMs()));
            lines.add(format("  Error Rate: %.2f%%", telemetry.getErrorRate() * 100));
            lines.add("  Request Count: " + telemetry.getRequestCount());
            if (telemetry.getCircuitStatus() != null) {
                lines.add("  Circuit: " + telemetry.getCircuitStatus());
            }
            lines.add("");
        }

        lines.add("Rationale: " + decision.getReason());
        return String.join("\n", lines);
    }

    private static Specification<DecisionEntity> buildSpecification(String organizationId, DecisionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("organizationId"), organizationId));
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), filter.getTo()));
            }
            if (filter.getTaskCategory() != null) {
                predicates.add(cb.equal(root.get("taskCategory"), filter.getTaskCategory().getId()));
            }
            if (filter.getProvider() != null && !filter.getProvider().isBlank()) {
                predicates.add(cb.equal(root.get("provider"), filter.getProvider()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static DecisionEntity toEntity(RoutingDecision decision) {
        return DecisionEntity.builder()
                .decisionId(decision.getDecisionId())
                .organizationId(decision.getOrganizationId())
                .reservationId(decision.getReservationId())
                .createdAt(decision.getTimestamp())
                .taskCategory(decision.getTaskCategory().getId())
                .provider(decision.getProvider())
                .model(decision.getModel())
                .estimatedCost(decision.getEstimatedCost())
                .totalScore(decision.getFactors() != null ? decision.getFactors().getTotalScore() : 0.0)
                .budgetStatus(decision.getBudgetStatus() != null ? decision.getBudgetStatus().name() : null)
                .forceCheapest(decision.isForceCheapest())
                .cacheHit(decision.isCacheHit())
                .abandoned(decision.isAbandoned())
                .cacheKey(decision.getCacheKey())
                .reason(decision.getReason())
                .factors(decision.getFactors())
                .alternatives(decision.getAlternatives())
                .constraints(decision.getConstraints())
                .telemetry(decision.getTelemetry())
                .build();
    }

    private static RoutingDecision toDecision(DecisionEntity entity) {
        return RoutingDecision.builder()
                .decisionId(entity.getDecisionId())
                .reservationId(entity.getReservationId())
                .organizationId(entity.getOrganizationId())
                .timestamp(entity.getCreatedAt())
                .taskCategory(TaskCategory.fromId(entity.getTaskCategory()))
                .provider(entity.getProvider())
                .model(entity.getModel())
                .estimatedCost(entity.getEstimatedCost())
                .factors(entity.getFactors())
                .alternatives(entity.getAlternatives() != null ? entity.getAlternatives() : new ArrayList<>())
                .constraints(entity.getConstraints())
                .telemetry(entity.getTelemetry())
                .budgetStatus(entity.getBudgetStatus() != null ? BudgetStatus.valueOf(entity.getBudgetStatus()) : null)
                .forceCheapest(entity.isForceCheapest())
                .cacheHit(entity.isCacheHit())
                .abandoned(entity.isAbandoned())
                .cacheKey(entity.getCacheKey())
                .reason(entity.getReason())
                .build();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private static final class ModelTally {
        private final String provider;
        private final String model;
        private long count;
        private double totalCost;
        private Instant lastUsed;

        private ModelTally(String provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        private void add(double cost, Instant at) {
            count++;
            totalCost += cost;
            if (lastUsed == null || at.isAfter(lastUsed)) {
                lastUsed = at;
            }
        }

        private DecisionSummary.ModelUsage toUsage() {
            return DecisionSummary.ModelUsage.builder()
                    .provider(provider)
                    .model(model)
                    .count(count)
                    .avgCost(count > 0 ? totalCost / count : 0.0)
                    .lastUsed(lastUsed)
                    .build();
        }
    }
}
