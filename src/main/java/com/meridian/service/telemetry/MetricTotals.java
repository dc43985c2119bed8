package com.meridian.service.telemetry;

import com.meridian.model.TelemetrySample;

/**
 * Additive telemetry sums. Averages are derived so totals can be combined and subtracted.
 */
public record MetricTotals(long count, long errors, double latencySum, double costSum) {

    public static final MetricTotals EMPTY = new MetricTotals(0, 0, 0.0, 0.0);

    public static MetricTotals of(TelemetrySample sample) {
        return new MetricTotals(1, sample.isSuccess() ? 0 : 1, sample.getLatencyMs(), sample.getCostUsd());
    }

    public MetricTotals plus(MetricTotals other) {
        return new MetricTotals(count + other.count, errors + other.errors,
                latencySum + other.latencySum, costSum + other.costSum);
    }

    public MetricTotals minus(MetricTotals other) {
        return new MetricTotals(Math.max(0, count - other.count), Math.max(0, errors - other.errors),
                Math.max(0.0, latencySum - other.latencySum), Math.max(0.0, costSum - other.costSum));
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public double avgLatencyMs() {
        return count == 0 ? 0.0 : latencySum / count;
    }

    public double errorRate() {
        return count == 0 ? 0.0 : (double) errors / count;
    }

    public double avgCost() {
        return count == 0 ? 0.0 : costSum / count;
    }
}
