package com.meridian.model;

/**
 * Health of a provider/model pair. CRITICAL is an open circuit (excluded from
 * selection), WARNING is half-open (eligible but penalized).
 */
public enum CircuitStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
