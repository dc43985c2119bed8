package com.meridian.service.telemetry;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.model.TelemetrySample;
import com.meridian.model.dto.AdaptationResult;
import com.meridian.repository.TelemetrySampleRepository;
import com.meridian.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Tests for PolicyAdaptationService over a live TelemetryAggregator.
 */
class PolicyAdaptationServiceTest {

    private MutableClock clock;
    private TelemetryAggregator aggregator;
    private PolicyAdaptationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        MonotonicClock monotonic = new MonotonicClock(clock);
        MeridianProperties properties = new MeridianProperties();
        properties.getTelemetry().setPersistSamples(false);
        aggregator = new TelemetryAggregator(mock(TelemetrySampleRepository.class), properties, monotonic);
        service = new PolicyAdaptationService(aggregator, properties, monotonic);
    }

    @Test
    void testVolatileLatencyRaisesAlphaAndStableLowersIt() {
        for (int i = 0; i < 12; i++) {
            record("openai", "gpt-4o", i % 2 == 0 ? 100 : 1000, true);
            record("openai", "gpt-4o-mini", 500, true);
        }

        AdaptationResult result = service.adapt();

        assertEquals(2, result.getAlphaAdjustments().size());
        AdaptationResult.AlphaAdjustment volatileModel = result.getAlphaAdjustments().get(0);
        assertEquals("gpt-4o", volatileModel.getModel());
        assertEquals(0.35, volatileModel.getNewAlpha(), 1e-9);
        assertTrue(volatileModel.getReason().startsWith("High variance"));
        AdaptationResult.AlphaAdjustment stableModel = result.getAlphaAdjustments().get(1);
        assertEquals(0.25, stableModel.getNewAlpha(), 1e-9);
        assertEquals(0.25, aggregator.alpha("openai", "gpt-4o-mini"), 1e-9);
        assertTrue(result.getProviderDisablements().isEmpty());
    }

    @Test
    void testAlphaStaysWithinBounds() {
        aggregator.setAlpha("openai", "gpt-4o-mini", 0.1);
        for (int i = 0; i < 12; i++) {
            record("openai", "gpt-4o-mini", 500, true);
        }

        AdaptationResult result = service.adapt();

        assertTrue(result.getAlphaAdjustments().isEmpty());
        assertEquals(0.1, aggregator.alpha("openai", "gpt-4o-mini"), 1e-9);
        assertEquals(List.of("No policy adaptations needed, all metrics within normal ranges"),
                result.getRecommendations());
    }

    @Test
    void testTooFewSamplesLeaveAlphaAlone() {
        for (int i = 0; i < 9; i++) {
            record("openai", "gpt-4o", i % 2 == 0 ? 100 : 1000, true);
        }

        assertTrue(service.adapt().getAlphaAdjustments().isEmpty());
        assertEquals(0.3, aggregator.alpha("openai", "gpt-4o"), 1e-9);
    }

    @Test
    void testFailingProviderFlaggedOnceThenRecovers() {
        for (int i = 0; i < 10; i++) {
            record("mistral", "mistral-small", 400, i >= 6);
        }

        AdaptationResult flagged = service.adapt();

        assertEquals(1, flagged.getProviderDisablements().size());
        assertEquals("mistral", flagged.getProviderDisablements().get(0).getProvider());
        assertEquals(0.6, flagged.getProviderDisablements().get(0).getErrorRate(), 1e-9);
        assertTrue(flagged.getRecommendations().stream().anyMatch(r -> r.contains("mistral")));
        assertEquals(Set.of("mistral"), service.flaggedProviders());

        assertTrue(service.adapt().getProviderDisablements().isEmpty());

        clock.advance(Duration.ofMinutes(6));
        for (int i = 0; i < 5; i++) {
            record("mistral", "mistral-small", 400, true);
        }

        AdaptationResult recovered = service.adapt();

        assertEquals(1, recovered.getProviderEnablements().size());
        assertEquals(0.0, recovered.getProviderEnablements().get(0).getErrorRate(), 1e-9);
        assertTrue(service.flaggedProviders().isEmpty());
    }

    @Test
    void testCoefficientOfVariation() {
        assertEquals(0.0, PolicyAdaptationService.coefficientOfVariation(List.of(5.0, 5.0, 5.0)), 1e-9);
        assertEquals(0.5, PolicyAdaptationService.coefficientOfVariation(List.of(1.0, 3.0)), 1e-9);
        assertEquals(0.0, PolicyAdaptationService.coefficientOfVariation(List.of(0.0, 0.0)), 1e-9);
    }

    private void record(String provider, String model, long latencyMs, boolean success) {
        aggregator.record(TelemetrySample.builder()
                .provider(provider)
                .model(model)
                .timestamp(clock.instant())
                .latencyMs(latencyMs)
                .success(success)
                .costUsd(0.001)
                .build());
    }
}
