package com.meridian.config;

import com.meridian.model.BudgetStatus;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Meridian.
 */
@Data
@Component
@ConfigurationProperties(prefix = "meridian")
public class MeridianProperties {

    private CounterConfig counters = new CounterConfig();
    private PolicyConfig policy = new PolicyConfig();
    private RateConfig rate = new RateConfig();
    private BudgetConfig budget = new BudgetConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();
    private CircuitConfig circuit = new CircuitConfig();
    private CacheConfig cache = new CacheConfig();
    private RoutingConfig routing = new RoutingConfig();
    private AdaptationConfig adaptation = new AdaptationConfig();

    /**
     * Model catalog. When empty the built-in catalog is used.
     */
    private List<ModelConfig> models = new ArrayList<>();

    @Data
    public static class CounterConfig {
        /**
         * "memory" (single node) or "redis" (shared across nodes).
         */
        private String backend = "memory";
        private String keyPrefix = "meridian:";
    }

    @Data
    public static class PolicyConfig {
        private int cacheMaxSize = 1000;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private TrialConfig trial = new TrialConfig();
    }

    @Data
    public static class TrialConfig {
        private double maxDailyCostUsd = 1.00;
        private double maxRequestCostUsd = 0.01;
        private int maxConcurrentJobs = 2;
        private int burstRateLimit = 5;
        private int sustainedRateLimit = 20;
    }

    @Data
    public static class RateConfig {
        private Duration burstWindow = Duration.ofSeconds(10);
        private Duration sustainedWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class BudgetConfig {
        private double warningThreshold = 0.80;
        private double criticalThreshold = 0.95;
        private Duration reservationTimeout = Duration.ofMinutes(10);
        private Duration counterTtl = Duration.ofHours(48);
    }

    @Data
    public static class TelemetryConfig {
        private int windowSize = 50;
        private Duration windowDuration = Duration.ofMinutes(5);
        private Duration baselineSpan = Duration.ofHours(24);
        private int minBaselineSamples = 10;
        private Duration hourlyRetention = Duration.ofHours(48);
        private Duration dailyRetention = Duration.ofDays(30);
        private double defaultLatencyMs = 1000.0;
        private boolean persistSamples = true;
        /**
         * Initial weight of a new latency sample in the smoothed latency.
         */
        private double ewmaAlpha = 0.3;
    }

    @Data
    public static class CircuitConfig {
        private double deviationThreshold = 0.2;
        private double errorRateCeiling = 0.3;
        private Duration coolDown = Duration.ofSeconds(60);
        private int minSamples = 5;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(24);
        private long maxEntries = 10000;
        private int minHitsToRetain = 2;
        private double nominalServingCostUsd = 0.0;
    }

    @Data
    public static class RoutingConfig {
        private Weights weights = new Weights();
        private double warningPenalty = 0.5;
        private double preferredBonus = 0.05;
        private BudgetStatus forceCheapestAt = BudgetStatus.CRITICAL;
        private Duration admissionTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class AdaptationConfig {
        private boolean enabled = true;
        private double minAlpha = 0.1;
        private double maxAlpha = 0.5;
        /**
         * Latency coefficient of variation the smoothing aims for.
         */
        private double targetVariance = 0.1;
        private double adjustmentStep = 0.05;
        private int minRequestsForTuning = 10;
        private double errorThreshold = 0.5;
        private int minRequestsBeforeDisable = 10;
        private double recoveryThreshold = 0.2;
        private int minRequestsBeforeEnable = 5;
    }

    @Data
    public static class Weights {
        private double cost = 0.3;
        private double latency = 0.2;
        private double error = 0.2;
        private double quality = 0.3;
    }

    @Data
    public static class ModelConfig {
        private String provider;
        private String model;
        private double inputPricePerMillion;
        private double outputPricePerMillion;
        private double quality;
        private Map<String, Double> categoryQuality = new HashMap<>();
        private List<String> taskCategories = new ArrayList<>();
    }
}
