package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a metric between the first and second half of a period.
 */
public enum Trend {
    INCREASING,
    STABLE,
    DECREASING;

    private static final double THRESHOLD = 0.10;

    public static Trend between(double firstHalf, double secondHalf) {
        if (firstHalf == 0.0) {
            return secondHalf > 0.0 ? INCREASING : STABLE;
        }
        double change = (secondHalf - firstHalf) / firstHalf;
        if (change > THRESHOLD) {
            return INCREASING;
        }
        if (change < -THRESHOLD) {
            return DECREASING;
        }
        return STABLE;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
