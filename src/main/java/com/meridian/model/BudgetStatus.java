package com.meridian.model;

/**
 * Daily budget consumption level, derived from spend / daily ceiling.
 */
public enum BudgetStatus {
    NORMAL,
    WARNING,
    CRITICAL,
    EXCEEDED;

    /**
     * Classify a usage ratio. Thresholds are fractions of the daily ceiling.
     */
    public static BudgetStatus of(double ratio, double warningThreshold, double criticalThreshold) {
        if (ratio >= 1.0) {
            return EXCEEDED;
        }
        if (ratio >= criticalThreshold) {
            return CRITICAL;
        }
        if (ratio >= warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }

    public boolean isAtLeast(BudgetStatus other) {
        return compareTo(other) >= 0;
    }
}
