package com.meridian.service.telemetry;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.entity.TelemetrySampleEntity;
import com.meridian.model.AggregatedMetric;
import com.meridian.model.Granularity;
import com.meridian.model.TelemetrySample;
import com.meridian.model.TelemetrySnapshot;
import com.meridian.model.Trend;
import com.meridian.model.dto.TelemetrySummary;
import com.meridian.repository.TelemetrySampleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rolling per-provider/per-model telemetry.
 *
 * <p>Each model keeps a short window of recent samples for health evaluation plus hourly
 * and daily buckets. A bucket is frozen into an immutable {@link AggregatedMetric} once its
 * period has ended; late samples for a frozen bucket only reach the persisted sample table.
 * Latency is also smoothed per model with an EWMA whose alpha the adaptation pass tunes.
 */
@Slf4j
@Service
public class TelemetryAggregator {

    private final TelemetrySampleRepository sampleRepository;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    private final ConcurrentMap<String, ModelTelemetry> models = new ConcurrentHashMap<>();

    public TelemetryAggregator(
            TelemetrySampleRepository sampleRepository,
            MeridianProperties properties,
            MonotonicClock clock) {
        this.sampleRepository = sampleRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Record a completed provider call. Persistence failures are logged, never thrown.
     */
    public void record(TelemetrySample sample) {
        if (properties.getTelemetry().isPersistSamples()) {
            persist(sample);
        }
        ingest(sample, false);
    }

    /**
     * Rebuild in-memory state from persisted samples of the baseline span.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!properties.getTelemetry().isPersistSamples()) {
            return;
        }
        Instant since = clock.instant().minus(properties.getTelemetry().getBaselineSpan());
        try {
            List<TelemetrySampleEntity> samples = sampleRepository.findByRecordedAtAfterOrderByRecordedAtAsc(since);
            samples.forEach(entity -> ingest(toSample(entity), true));
            log.info("Telemetry warm-up loaded {} samples across {} models", samples.size(), models.size());
        } catch (DataAccessException e) {
            log.warn("Telemetry warm-up failed, starting with empty state: {}", e.getMessage());
        }
    }

    /**
     * Samples in the short window (last N within the window duration).
     */
    public MetricTotals currentWindow(String provider, String model) {
        return currentWindowSince(provider, model, null);
    }

    /**
     * Short window restricted to samples taken strictly after {@code since} (null for no bound).
     */
    public MetricTotals currentWindowSince(String provider, String model, Instant since) {
        ModelTelemetry telemetry = models.get(key(provider, model));
        if (telemetry == null) {
            return MetricTotals.EMPTY;
        }
        Instant now = clock.instant();
        synchronized (telemetry) {
            trimWindow(telemetry, now);
            MetricTotals totals = MetricTotals.EMPTY;
            for (TelemetrySample sample : telemetry.window) {
                if (since == null || sample.getTimestamp().isAfter(since)) {
                    totals = totals.plus(MetricTotals.of(sample));
                }
            }
            return totals;
        }
    }

    /**
     * Trailing baseline span of hourly buckets, excluding the short window's samples so that
     * a degradation does not dilute the reference it is compared against. Empty when fewer
     * than the configured minimum samples are available.
     */
    public MetricTotals baseline(String provider, String model) {
        ModelTelemetry telemetry = models.get(key(provider, model));
        if (telemetry == null) {
            return MetricTotals.EMPTY;
        }
        Instant now = clock.instant();
        Instant floor = Granularity.HOURLY.bucketStart(now.minus(properties.getTelemetry().getBaselineSpan()));
        MetricTotals window = currentWindow(provider, model);

        MetricTotals total = MetricTotals.EMPTY;
        synchronized (telemetry) {
            for (Bucket bucket : telemetry.hourly.tailMap(floor, true).values()) {
                total = total.plus(bucket.totals);
            }
        }
        MetricTotals baseline = total.minus(window);
        return baseline.count() >= properties.getTelemetry().getMinBaselineSamples() ? baseline : MetricTotals.EMPTY;
    }

    /**
     * Near-real-time view used for scoring: the short window, falling back to the baseline,
     * then to the configured default latency for models without data.
     */
    public TelemetrySnapshot snapshot(String provider, String model) {
        MetricTotals window = currentWindow(provider, model);
        MetricTotals source = window.isEmpty() ? baseline(provider, model) : window;

        double latency = source.isEmpty() ? properties.getTelemetry().getDefaultLatencyMs() : source.avgLatencyMs();
        ModelTelemetry telemetry = models.get(key(provider, model));
        double smoothed = latency;
        if (telemetry != null) {
            synchronized (telemetry) {
                if (telemetry.smoothedLatencyMs != null) {
                    smoothed = telemetry.smoothedLatencyMs;
                }
            }
        }

        return TelemetrySnapshot.builder()
                .provider(provider)
                .model(model)
                .latencyMs(latency)
                .smoothedLatencyMs(smoothed)
                .errorRate(source.errorRate())
                .requestCount(window.count())
                .avgCostUsd(source.avgCost())
                .build();
    }

    /**
     * Bucketed metrics for every model, ordered by period then provider/model.
     */
    public List<AggregatedMetric> aggregates(Granularity granularity, Instant from, Instant to) {
        Instant now = clock.instant();
        List<AggregatedMetric> result = new ArrayList<>();
        for (ModelTelemetry telemetry : models.values()) {
            synchronized (telemetry) {
                for (Bucket bucket : telemetry.buckets(granularity).subMap(
                        granularity.bucketStart(from), true, to, false).values()) {
                    result.add(bucket.view(now));
                }
            }
        }
        result.sort(Comparator.comparing(AggregatedMetric::getPeriodStart)
                .thenComparing(AggregatedMetric::getProvider)
                .thenComparing(AggregatedMetric::getModel));
        return result;
    }

    /**
     * Rollup over [from, to) from hourly buckets, with trends comparing the two halves.
     */
    public TelemetrySummary summary(Instant from, Instant to) {
        Instant midpoint = from.plus(Duration.between(from, to).dividedBy(2));
        MetricTotals firstHalf = MetricTotals.EMPTY;
        MetricTotals secondHalf = MetricTotals.EMPTY;
        Map<String, MetricTotals> byModel = new TreeMap<>();

        for (AggregatedMetric metric : aggregates(Granularity.HOURLY, from, to)) {
            MetricTotals totals = toTotals(metric);
            if (metric.getPeriodStart().isBefore(midpoint)) {
                firstHalf = firstHalf.plus(totals);
            } else {
                secondHalf = secondHalf.plus(totals);
            }
            byModel.merge(metric.getProvider() + ":" + metric.getModel(), totals, MetricTotals::plus);
        }

        MetricTotals all = firstHalf.plus(secondHalf);
        List<TelemetrySummary.ModelSummary> models = new ArrayList<>();
        byModel.forEach((key, totals) -> {
            String[] parts = key.split(":", 2);
            models.add(TelemetrySummary.ModelSummary.builder()
                    .provider(parts[0])
                    .model(parts[1])
                    .requests(totals.count())
                    .avgLatencyMs(totals.avgLatencyMs())
                    .errorRate(totals.errorRate())
                    .totalCostUsd(totals.costSum())
                    .build());
        });

        return TelemetrySummary.builder()
                .from(from)
                .to(to)
                .totalRequests(all.count())
                .avgLatencyMs(all.avgLatencyMs())
                .errorRate(all.errorRate())
                .totalCostUsd(all.costSum())
                .latencyTrend(Trend.between(firstHalf.avgLatencyMs(), secondHalf.avgLatencyMs()))
                .errorRateTrend(Trend.between(firstHalf.errorRate(), secondHalf.errorRate()))
                .costTrend(Trend.between(firstHalf.costSum(), secondHalf.costSum()))
                .byModel(models)
                .build();
    }

    /**
     * Latencies of the samples currently in the short window, oldest first.
     */
    public List<Double> windowLatencies(String provider, String model) {
        ModelTelemetry telemetry = models.get(key(provider, model));
        if (telemetry == null) {
            return List.of();
        }
        Instant now = clock.instant();
        synchronized (telemetry) {
            trimWindow(telemetry, now);
            return telemetry.window.stream().map(TelemetrySample::getLatencyMs).toList();
        }
    }

    public double alpha(String provider, String model) {
        ModelTelemetry telemetry = models.get(key(provider, model));
        if (telemetry == null) {
            return properties.getTelemetry().getEwmaAlpha();
        }
        synchronized (telemetry) {
            return telemetry.alpha;
        }
    }

    /**
     * Set the EWMA weight for new latency samples of a tracked model.
     *
     * @throws IllegalArgumentException when alpha is outside (0, 1]
     */
    public void setAlpha(String provider, String model, double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("EWMA alpha must be in (0, 1]: " + alpha);
        }
        ModelTelemetry telemetry = models.computeIfAbsent(key(provider, model),
                k -> new ModelTelemetry(provider, model, properties.getTelemetry().getEwmaAlpha()));
        synchronized (telemetry) {
            telemetry.alpha = alpha;
        }
    }

    /**
     * Provider/model keys ("provider:model") with any telemetry.
     */
    public Set<String> trackedModels() {
        return Set.copyOf(models.keySet());
    }

    /**
     * Drop buckets past retention and persisted samples older than the baseline span.
     */
    public int prune() {
        Instant now = clock.instant();
        Instant hourlyFloor = now.minus(properties.getTelemetry().getHourlyRetention());
        Instant dailyFloor = now.minus(properties.getTelemetry().getDailyRetention());
        int removed = 0;

        for (ModelTelemetry telemetry : models.values()) {
            synchronized (telemetry) {
                NavigableMap<Instant, Bucket> oldHourly = telemetry.hourly.headMap(hourlyFloor, false);
                NavigableMap<Instant, Bucket> oldDaily = telemetry.daily.headMap(dailyFloor, false);
                removed += oldHourly.size() + oldDaily.size();
                oldHourly.clear();
                oldDaily.clear();
                trimWindow(telemetry, now);
            }
        }

        if (properties.getTelemetry().isPersistSamples()) {
            try {
                int deleted = sampleRepository.deleteOlderThan(hourlyFloor);
                log.debug("Deleted {} persisted telemetry samples older than {}", deleted, hourlyFloor);
            } catch (DataAccessException e) {
                log.error("Failed to prune persisted telemetry samples", e);
            }
        }
        if (removed > 0) {
            log.info("Pruned {} telemetry buckets", removed);
        }
        return removed;
    }

    private void persist(TelemetrySample sample) {
        try {
            sampleRepository.save(TelemetrySampleEntity.builder()
                    .provider(sample.getProvider())
                    .model(sample.getModel())
                    .recordedAt(sample.getTimestamp())
                    .latencyMs(sample.getLatencyMs())
                    .success(sample.isSuccess())
                    .costUsd(sample.getCostUsd())
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to persist telemetry sample for {}", sample.key(), e);
        }
    }

    /**
     * Replayed samples may fill buckets whose period has already ended, since those buckets
     * are being rebuilt rather than amended.
     */
    private void ingest(TelemetrySample sample, boolean replay) {
        ModelTelemetry telemetry = models.computeIfAbsent(sample.key(),
                k -> new ModelTelemetry(sample.getProvider(), sample.getModel(),
                        properties.getTelemetry().getEwmaAlpha()));
        Instant now = clock.instant();

        synchronized (telemetry) {
            telemetry.smoothedLatencyMs = telemetry.smoothedLatencyMs == null
                    ? sample.getLatencyMs()
                    : telemetry.alpha * sample.getLatencyMs() + (1.0 - telemetry.alpha) * telemetry.smoothedLatencyMs;
            telemetry.window.addLast(sample);
            trimWindow(telemetry, now);
            addToBucket(telemetry, Granularity.HOURLY, sample, now, replay);
            addToBucket(telemetry, Granularity.DAILY, sample, now, replay);
        }
    }

    private void addToBucket(ModelTelemetry telemetry, Granularity granularity, TelemetrySample sample,
                             Instant now, boolean replay) {
        Instant start = granularity.bucketStart(sample.getTimestamp());
        Bucket bucket = telemetry.buckets(granularity).computeIfAbsent(start,
                s -> new Bucket(telemetry.provider, telemetry.model, granularity, s));
        if (replay ? bucket.frozen != null : bucket.isFrozen(now)) {
            log.debug("Sample for {} falls in closed {} bucket {}", sample.key(), granularity, start);
            return;
        }
        bucket.totals = bucket.totals.plus(MetricTotals.of(sample));
    }

    private void trimWindow(ModelTelemetry telemetry, Instant now) {
        Instant cutoff = now.minus(properties.getTelemetry().getWindowDuration());
        int maxSize = properties.getTelemetry().getWindowSize();
        while (!telemetry.window.isEmpty()
                && (telemetry.window.size() > maxSize || !telemetry.window.peekFirst().getTimestamp().isAfter(cutoff))) {
            telemetry.window.removeFirst();
        }
    }

    private static MetricTotals toTotals(AggregatedMetric metric) {
        long errors = Math.round(metric.getErrorRate() * metric.getTotalRequests());
        return new MetricTotals(metric.getTotalRequests(), errors,
                metric.getAvgLatencyMs() * metric.getTotalRequests(), metric.getTotalCostUsd());
    }

    private static TelemetrySample toSample(TelemetrySampleEntity entity) {
        return TelemetrySample.builder()
                .provider(entity.getProvider())
                .model(entity.getModel())
                .timestamp(entity.getRecordedAt())
                .latencyMs(entity.getLatencyMs())
                .success(entity.isSuccess())
                .costUsd(entity.getCostUsd())
                .build();
    }

    private static String key(String provider, String model) {
        return provider + ":" + model;
    }

    private static final class ModelTelemetry {
        private final String provider;
        private final String model;
        private final Deque<TelemetrySample> window = new ArrayDeque<>();
        private final NavigableMap<Instant, Bucket> hourly = new TreeMap<>();
        private final NavigableMap<Instant, Bucket> daily = new TreeMap<>();
        private double alpha;
        private Double smoothedLatencyMs;

        private ModelTelemetry(String provider, String model, double alpha) {
            this.provider = provider;
            this.model = model;
            this.alpha = alpha;
        }

        private NavigableMap<Instant, Bucket> buckets(Granularity granularity) {
            return granularity == Granularity.HOURLY ? hourly : daily;
        }
    }

    private static final class Bucket {
        private final String provider;
        private final String model;
        private final Granularity granularity;
        private final Instant start;
        private MetricTotals totals = MetricTotals.EMPTY;
        private AggregatedMetric frozen;

        private Bucket(String provider, String model, Granularity granularity, Instant start) {
            this.provider = provider;
            this.model = model;
            this.granularity = granularity;
            this.start = start;
        }

        private boolean isFrozen(Instant now) {
            if (frozen == null && !start.plus(granularity.getSpan()).isAfter(now)) {
                frozen = toMetric();
            }
            return frozen != null;
        }

        private AggregatedMetric view(Instant now) {
            return isFrozen(now) ? frozen : toMetric();
        }

        private AggregatedMetric toMetric() {
            return AggregatedMetric.builder()
                    .provider(provider)
                    .model(model)
                    .granularity(granularity)
                    .periodStart(start)
                    .avgLatencyMs(totals.avgLatencyMs())
                    .errorRate(totals.errorRate())
                    .avgCostPerRequest(totals.avgCost())
                    .totalRequests(totals.count())
                    .successRate(totals.isEmpty() ? 0.0 : 1.0 - totals.errorRate())
                    .totalCostUsd(totals.costSum())
                    .build();
        }
    }
}
