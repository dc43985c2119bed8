package com.meridian.service.routing;

import com.meridian.config.MeridianProperties;
import com.meridian.model.CircuitStatus;
import com.meridian.model.ModelSpec;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TaskCategory;
import com.meridian.model.TelemetrySnapshot;
import com.meridian.service.telemetry.CircuitBreakerService;
import com.meridian.service.telemetry.TelemetryAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-factor scoring of eligible candidates.
 *
 * Cost and latency are range-normalized over the candidate set (lower is better, a zero
 * range scores 1.0). Error score is {@code 1 - errorRate}. Quality is the static rating for
 * the category. WARNING circuits are multiplied by the penalty; preferred models get a bonus.
 */
@Slf4j
@Component
public class CandidateScorer {

    private final TelemetryAggregator telemetry;
    private final CircuitBreakerService circuitBreaker;
    private final MeridianProperties properties;

    public CandidateScorer(TelemetryAggregator telemetry, CircuitBreakerService circuitBreaker,
                           MeridianProperties properties) {
        this.telemetry = telemetry;
        this.circuitBreaker = circuitBreaker;
        this.properties = properties;
    }

    public List<ScoredCandidate> score(CandidateSet candidates) {
        List<ModelSpec> eligible = candidates.eligible();
        TaskCategory category = candidates.category();
        MeridianProperties.Weights weights = properties.getRouting().getWeights();

        List<TelemetrySnapshot> snapshots = new ArrayList<>();
        double minCost = Double.MAX_VALUE;
        double maxCost = -Double.MAX_VALUE;
        double minLatency = Double.MAX_VALUE;
        double maxLatency = -Double.MAX_VALUE;

        for (ModelSpec spec : eligible) {
            TelemetrySnapshot snapshot = snapshot(spec);
            snapshots.add(snapshot);

            double cost = candidates.costOf(spec);
            minCost = Math.min(minCost, cost);
            maxCost = Math.max(maxCost, cost);
            minLatency = Math.min(minLatency, snapshot.getLatencyMs());
            maxLatency = Math.max(maxLatency, snapshot.getLatencyMs());
        }

        List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
        for (int i = 0; i < eligible.size(); i++) {
            ModelSpec spec = eligible.get(i);
            TelemetrySnapshot snapshot = snapshots.get(i);
            double cost = candidates.costOf(spec);

            double costScore = lowerIsBetter(cost, minCost, maxCost);
            double latencyScore = lowerIsBetter(snapshot.getLatencyMs(), minLatency, maxLatency);
            double errorScore = clamp(1.0 - snapshot.getErrorRate());
            double qualityScore = spec.qualityFor(category);

            double total = weights.getCost() * costScore
                    + weights.getLatency() * latencyScore
                    + weights.getError() * errorScore
                    + weights.getQuality() * qualityScore;

            if (snapshot.getCircuitStatus() == CircuitStatus.WARNING) {
                total *= properties.getRouting().getWarningPenalty();
            }
            boolean preferred = candidates.preferredModels().contains(spec.getModel());
            if (preferred) {
                total += properties.getRouting().getPreferredBonus();
            }

            ScoreFactors factors = ScoreFactors.builder()
                    .costScore(costScore)
                    .latencyScore(latencyScore)
                    .errorScore(errorScore)
                    .qualityScore(qualityScore)
                    .totalScore(total)
                    .build();

            log.debug("Scored {} cost={} latency={} error={} quality={} total={} circuit={}",
                    spec.key(), costScore, latencyScore, errorScore, qualityScore, total, snapshot.getCircuitStatus());
            scored.add(new ScoredCandidate(spec, cost, factors, snapshot, preferred));
        }
        return scored;
    }

    /**
     * Telemetry for one model with its current circuit status.
     */
    public TelemetrySnapshot snapshot(ModelSpec spec) {
        TelemetrySnapshot snapshot = telemetry.snapshot(spec.getProvider(), spec.getModel());
        snapshot.setCircuitStatus(circuitBreaker.stateOf(spec.getProvider(), spec.getModel()).getStatus());
        return snapshot;
    }

    static double lowerIsBetter(double value, double min, double max) {
        double range = max - min;
        if (range <= 0.0) {
            return 1.0;
        }
        return clamp((max - value) / range);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
