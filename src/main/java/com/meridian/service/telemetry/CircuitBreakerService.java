package com.meridian.service.telemetry;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.model.CircuitState;
import com.meridian.model.CircuitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Health state per provider/model, derived from the short telemetry window compared
 * against the trailing baseline.
 *
 * <p>HEALTHY: both deviations within threshold. WARNING: one dimension over. CRITICAL: both
 * over, or the window error rate above the absolute ceiling. A CRITICAL circuit holds for the
 * cool-down; afterwards only samples recorded since the trip are evaluated. With too few of
 * those the model is let through as WARNING so that traffic can produce them.
 */
@Slf4j
@Service
public class CircuitBreakerService {

    private final TelemetryAggregator telemetry;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    private final ConcurrentMap<String, CircuitState> states = new ConcurrentHashMap<>();

    public CircuitBreakerService(TelemetryAggregator telemetry, MeridianProperties properties, MonotonicClock clock) {
        this.telemetry = telemetry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Re-evaluate one provider/model and return its state.
     */
    public CircuitState evaluate(String provider, String model) {
        Instant now = clock.instant();
        return states.compute(key(provider, model), (k, previous) -> {
            CircuitState current = previous != null ? previous : CircuitState.healthy(provider, model, now);
            CircuitState next = nextState(current, now);
            logTransition(current, next);
            return next;
        });
    }

    /**
     * Current state, evaluated lazily so cool-down expiry is observed without new samples.
     */
    public CircuitState stateOf(String provider, String model) {
        return evaluate(provider, model);
    }

    public boolean isOpen(String provider, String model) {
        return stateOf(provider, model).getStatus() == CircuitStatus.CRITICAL;
    }

    /**
     * States of every model with telemetry or circuit history, ordered by provider/model.
     */
    public List<CircuitState> states() {
        Set<String> keys = new TreeSet<>(telemetry.trackedModels());
        keys.addAll(states.keySet());

        List<CircuitState> result = new ArrayList<>();
        for (String key : keys) {
            String[] parts = key.split(":", 2);
            result.add(evaluate(parts[0], parts[1]));
        }
        result.sort(Comparator.comparing(CircuitState::getProvider).thenComparing(CircuitState::getModel));
        return result;
    }

    /**
     * Force a circuit back to HEALTHY. Samples recorded before the reset are ignored afterwards.
     */
    public CircuitState reset(String provider, String model) {
        Instant now = clock.instant();
        CircuitState state = CircuitState.healthy(provider, model, now).toBuilder()
                .samplesSince(now)
                .build();
        states.put(key(provider, model), state);
        log.info("Circuit for {}:{} manually reset to HEALTHY", provider, model);
        return state;
    }

    private CircuitState nextState(CircuitState current, Instant now) {
        MeridianProperties.CircuitConfig config = properties.getCircuit();
        String provider = current.getProvider();
        String model = current.getModel();

        if (current.getStatus() == CircuitStatus.CRITICAL
                && current.getOpenedAt() != null
                && now.isBefore(current.getOpenedAt().plus(config.getCoolDown()))) {
            return current;
        }

        MetricTotals window = telemetry.currentWindowSince(provider, model, current.getSamplesSince());
        if (window.count() < config.getMinSamples()) {
            if (current.getStatus() == CircuitStatus.CRITICAL) {
                // cool-down over, nothing fresh to judge: half-open
                return current.toBuilder()
                        .status(CircuitStatus.WARNING)
                        .windowSamples(window.count())
                        .updatedAt(now)
                        .build();
            }
            return current;
        }

        MetricTotals baseline = telemetry.baseline(provider, model);
        double currentLatency = window.avgLatencyMs();
        double currentErrorRate = window.errorRate();
        double baselineLatency = baseline.avgLatencyMs();
        double baselineErrorRate = baseline.errorRate();

        double latencyDeviation = baseline.isEmpty() ? 0.0 : deviation(currentLatency, baselineLatency);
        double errorDeviation = baseline.isEmpty() ? 0.0 : deviation(currentErrorRate, baselineErrorRate);

        boolean latencyOver = latencyDeviation > config.getDeviationThreshold();
        boolean errorOver = errorDeviation > config.getDeviationThreshold();

        CircuitStatus status;
        if (currentErrorRate > config.getErrorRateCeiling() || (latencyOver && errorOver)) {
            status = CircuitStatus.CRITICAL;
        } else if (latencyOver || errorOver) {
            status = CircuitStatus.WARNING;
        } else {
            status = CircuitStatus.HEALTHY;
        }

        CircuitState.CircuitStateBuilder next = current.toBuilder()
                .status(status)
                .baselineLatency(baselineLatency)
                .baselineErrorRate(baselineErrorRate)
                .currentLatency(currentLatency)
                .currentErrorRate(currentErrorRate)
                .latencyDeviation(latencyDeviation)
                .errorDeviation(errorDeviation)
                .deviation(Math.max(latencyDeviation, errorDeviation))
                .windowSamples(window.count())
                .updatedAt(now);

        if (status == CircuitStatus.CRITICAL) {
            // (re)start the cool-down; samples up to now are spent
            next.openedAt(now).samplesSince(now);
        }
        return next.build();
    }

    /**
     * Relative deviation {@code |current - baseline| / baseline}. A zero baseline yields 1 when
     * the current value is positive and 0 otherwise.
     */
    static double deviation(double current, double baseline) {
        if (baseline == 0.0) {
            return current > 0.0 ? 1.0 : 0.0;
        }
        return Math.abs(current - baseline) / baseline;
    }

    private void logTransition(CircuitState previous, CircuitState next) {
        if (previous.getStatus() == next.getStatus()) {
            if (next.getStatus() == CircuitStatus.CRITICAL && next.getOpenedAt() != null
                    && !next.getOpenedAt().equals(previous.getOpenedAt())) {
                log.warn("Circuit for {}:{} still CRITICAL after cool-down (errorRate={}, latency={}ms), restarting cool-down",
                        next.getProvider(), next.getModel(), next.getCurrentErrorRate(), next.getCurrentLatency());
            }
            return;
        }
        if (next.getStatus() == CircuitStatus.HEALTHY) {
            log.info("Circuit for {}:{} recovered: {} -> HEALTHY",
                    next.getProvider(), next.getModel(), previous.getStatus());
        } else {
            log.warn("Circuit for {}:{} {} -> {} (errorRate={} vs {}, latency={}ms vs {}ms, deviation={})",
                    next.getProvider(), next.getModel(), previous.getStatus(), next.getStatus(),
                    next.getCurrentErrorRate(), next.getBaselineErrorRate(),
                    next.getCurrentLatency(), next.getBaselineLatency(), next.getDeviation());
        }
    }

    private static String key(String provider, String model) {
        return provider + ":" + model;
    }
}
