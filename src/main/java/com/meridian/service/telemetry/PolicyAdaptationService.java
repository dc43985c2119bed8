package com.meridian.service.telemetry;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.model.dto.AdaptationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic tuning driven by live telemetry.
 *
 * Flow:
 * 1. Per model, compare the latency coefficient of variation in the short window with the
 *    target: volatile models get a higher EWMA alpha, stable ones a lower one, within bounds
 * 2. Per provider, flag error rates at or above the disable threshold
 * 3. Flagged providers whose error rate fell to the recovery threshold are cleared
 * 4. Summarize as recommendations
 */
@Slf4j
@Service
public class PolicyAdaptationService {

    private final TelemetryAggregator telemetry;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    private final Set<String> flaggedProviders = ConcurrentHashMap.newKeySet();

    public PolicyAdaptationService(TelemetryAggregator telemetry, MeridianProperties properties,
                                   MonotonicClock clock) {
        this.telemetry = telemetry;
        this.properties = properties;
        this.clock = clock;
    }

    public AdaptationResult adapt() {
        MeridianProperties.AdaptationConfig config = properties.getAdaptation();
        Set<String> models = new TreeSet<>(telemetry.trackedModels());

        List<AdaptationResult.AlphaAdjustment> adjustments = new ArrayList<>();
        Map<String, MetricTotals> byProvider = new TreeMap<>();
        for (String key : models) {
            String[] parts = key.split(":", 2);
            tuneAlpha(parts[0], parts[1], config).ifPresent(adjustments::add);
            byProvider.merge(parts[0], telemetry.currentWindow(parts[0], parts[1]), MetricTotals::plus);
        }

        List<AdaptationResult.ProviderChange> disablements = new ArrayList<>();
        List<AdaptationResult.ProviderChange> enablements = new ArrayList<>();
        byProvider.forEach((provider, totals) -> {
            if (!flaggedProviders.contains(provider)
                    && totals.count() >= config.getMinRequestsBeforeDisable()
                    && totals.errorRate() >= config.getErrorThreshold()) {
                flaggedProviders.add(provider);
                disablements.add(change(provider, totals, config.getErrorThreshold(), String.format(
                        "Error rate %.1f%% exceeds threshold %.1f%%",
                        totals.errorRate() * 100, config.getErrorThreshold() * 100)));
                log.warn("Provider {} error rate {} over {} requests, recommending removal from allowed providers",
                        provider, totals.errorRate(), totals.count());
            } else if (flaggedProviders.contains(provider)
                    && totals.count() >= config.getMinRequestsBeforeEnable()
                    && totals.errorRate() <= config.getRecoveryThreshold()) {
                flaggedProviders.remove(provider);
                enablements.add(change(provider, totals, config.getRecoveryThreshold(), String.format(
                        "Error rate %.1f%% below recovery threshold %.1f%%",
                        totals.errorRate() * 100, config.getRecoveryThreshold() * 100)));
                log.info("Provider {} recovered to error rate {}, recommending it be allowed again",
                        provider, totals.errorRate());
            }
        });

        List<String> recommendations = new ArrayList<>();
        if (!adjustments.isEmpty()) {
            recommendations.add(String.format("Adjusted EWMA alpha for %d models to track latency more closely",
                    adjustments.size()));
        }
        if (!disablements.isEmpty()) {
            recommendations.add(String.format("Remove %d providers from allowed providers due to high error rates: %s",
                    disablements.size(), providers(disablements)));
        }
        if (!enablements.isEmpty()) {
            recommendations.add(String.format("Allow %d recovered providers again: %s",
                    enablements.size(), providers(enablements)));
        }
        if (recommendations.isEmpty()) {
            recommendations.add("No policy adaptations needed, all metrics within normal ranges");
        }

        log.info("Policy adaptation: {} alpha adjustments, {} disablements, {} enablements",
                adjustments.size(), disablements.size(), enablements.size());

        return AdaptationResult.builder()
                .timestamp(clock.instant())
                .alphaAdjustments(adjustments)
                .providerDisablements(disablements)
                .providerEnablements(enablements)
                .recommendations(recommendations)
                .build();
    }

    public Set<String> flaggedProviders() {
        return Set.copyOf(flaggedProviders);
    }

    private Optional<AdaptationResult.AlphaAdjustment> tuneAlpha(
            String provider, String model, MeridianProperties.AdaptationConfig config) {
        List<Double> latencies = telemetry.windowLatencies(provider, model);
        if (latencies.size() < config.getMinRequestsForTuning()) {
            return Optional.empty();
        }

        double variance = coefficientOfVariation(latencies);
        double current = telemetry.alpha(provider, model);
        double next = current;
        String reason;
        if (variance > config.getTargetVariance()) {
            next = Math.min(current + config.getAdjustmentStep(), config.getMaxAlpha());
            reason = String.format("High variance (%.3f), increasing reactivity", variance);
        } else if (variance < config.getTargetVariance() / 2) {
            next = Math.max(current - config.getAdjustmentStep(), config.getMinAlpha());
            reason = String.format("Low variance (%.3f), increasing smoothing", variance);
        } else {
            return Optional.empty();
        }

        if (Math.abs(next - current) < 1e-9) {
            return Optional.empty();
        }
        telemetry.setAlpha(provider, model, next);
        log.info("Adjusted EWMA alpha for {}:{} from {} to {}: {}", provider, model, current, next, reason);

        return Optional.of(AdaptationResult.AlphaAdjustment.builder()
                .provider(provider)
                .model(model)
                .oldAlpha(current)
                .newAlpha(next)
                .variance(variance)
                .reason(reason)
                .build());
    }

    /**
     * Standard deviation over mean; 0 when the mean is 0.
     */
    static double coefficientOfVariation(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (mean <= 0.0) {
            return 0.0;
        }
        double squares = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
        return Math.sqrt(squares / values.size()) / mean;
    }

    private static AdaptationResult.ProviderChange change(String provider, MetricTotals totals, double threshold,
                                                          String reason) {
        return AdaptationResult.ProviderChange.builder()
                .provider(provider)
                .errorRate(totals.errorRate())
                .requests(totals.count())
                .threshold(threshold)
                .reason(reason)
                .build();
    }

    private static String providers(List<AdaptationResult.ProviderChange> changes) {
        return String.join(", ", changes.stream().map(AdaptationResult.ProviderChange::getProvider).toList());
    }
}
