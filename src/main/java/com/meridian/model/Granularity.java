package com.meridian.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Telemetry bucket sizes.
 */
public enum Granularity {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1));

    private final Duration span;

    Granularity(Duration span) {
        this.span = span;
    }

    public Duration getSpan() {
        return span;
    }

    /**
     * Start of the bucket containing {@code instant} (UTC aligned).
     */
    public Instant bucketStart(Instant instant) {
        return this == HOURLY
                ? instant.truncatedTo(ChronoUnit.HOURS)
                : instant.truncatedTo(ChronoUnit.DAYS);
    }

    public static Granularity fromId(String id) {
        for (Granularity g : values()) {
            if (g.name().equalsIgnoreCase(id)) {
                return g;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + id);
    }
}
