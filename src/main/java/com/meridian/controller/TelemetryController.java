package com.meridian.controller;

import com.meridian.counter.MonotonicClock;
import com.meridian.model.AggregatedMetric;
import com.meridian.model.Granularity;
import com.meridian.model.dto.TelemetrySummary;
import com.meridian.service.telemetry.TelemetryAggregator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read access to aggregated provider telemetry.
 */
@RestController
@RequestMapping("/v1/telemetry")
public class TelemetryController {

    private static final Duration DEFAULT_PERIOD = Duration.ofHours(24);

    private final TelemetryAggregator telemetry;
    private final MonotonicClock clock;

    public TelemetryController(TelemetryAggregator telemetry, MonotonicClock clock) {
        this.telemetry = telemetry;
        this.clock = clock;
    }

    /**
     * @param granularity hourly or daily (default hourly)
     */
    @GetMapping("/aggregates")
    public ResponseEntity<List<AggregatedMetric>> getAggregates(
            @RequestParam(defaultValue = "hourly") String granularity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_PERIOD);
        return ResponseEntity.ok(telemetry.aggregates(Granularity.fromId(granularity), start, end));
    }

    @GetMapping("/summary")
    public ResponseEntity<TelemetrySummary> getSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_PERIOD);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return ResponseEntity.ok(telemetry.summary(start, end));
    }
}
