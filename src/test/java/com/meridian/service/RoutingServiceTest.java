package com.meridian.service;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.InMemoryCounterStore;
import com.meridian.counter.InMemoryReservationStore;
import com.meridian.counter.MonotonicClock;
import com.meridian.exception.AdmissionDeniedException;
import com.meridian.exception.NoEligibleModelException;
import com.meridian.model.BudgetStatus;
import com.meridian.model.CallerConstraints;
import com.meridian.model.CircuitState;
import com.meridian.model.CircuitStatus;
import com.meridian.model.DenialReason;
import com.meridian.model.ModelSpec;
import com.meridian.model.OutcomeReport;
import com.meridian.model.Policy;
import com.meridian.model.Reservation;
import com.meridian.model.RoutingDecision;
import com.meridian.model.RoutingRequest;
import com.meridian.model.TaskCategory;
import com.meridian.model.TelemetrySample;
import com.meridian.model.TelemetrySnapshot;
import com.meridian.model.UsageSnapshot;
import com.meridian.model.dto.GuardrailStatus;
import com.meridian.service.cache.CacheLookup;
import com.meridian.service.cache.ResponseCacheService;
import com.meridian.service.routing.CandidateScorer;
import com.meridian.service.routing.DecisionEngine;
import com.meridian.service.telemetry.CircuitBreakerService;
import com.meridian.service.telemetry.TelemetryAggregator;
import com.meridian.support.Fixtures;
import com.meridian.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RoutingService: admission, selection and outcome reconciliation wired together
 * over the in-memory counter store.
 */
class RoutingServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private MonotonicClock monotonic;
    private MeridianProperties properties;
    private PolicyStore policyStore;
    private InMemoryCounterStore counters;
    private InMemoryReservationStore reservations;
    private BudgetGate budgetGate;
    private RateLimiter rateLimiter;
    private TelemetryAggregator telemetry;
    private CircuitBreakerService circuitBreaker;
    private ResponseCacheService cacheService;
    private DecisionLogService decisionLog;

    private final Map<String, double[]> observed = new HashMap<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        monotonic = new MonotonicClock(clock);
        properties = new MeridianProperties();
        policyStore = mock(PolicyStore.class);
        counters = new InMemoryCounterStore(monotonic);
        reservations = new InMemoryReservationStore(monotonic);
        budgetGate = new BudgetGate(counters, reservations, policyStore, properties, monotonic);
        rateLimiter = new RateLimiter(counters, policyStore, properties, monotonic);

        telemetry = mock(TelemetryAggregator.class);
        circuitBreaker = mock(CircuitBreakerService.class);
        cacheService = mock(ResponseCacheService.class);
        decisionLog = mock(DecisionLogService.class);

        when(telemetry.snapshot(anyString(), anyString())).thenAnswer(inv -> {
            String provider = inv.getArgument(0);
            String model = inv.getArgument(1);
            double[] values = observed.getOrDefault(provider + ":" + model, new double[]{1000, 0.0});
            return TelemetrySnapshot.builder()
                    .provider(provider)
                    .model(model)
                    .latencyMs(values[0])
                    .errorRate(values[1])
                    .requestCount(10)
                    .circuitStatus(CircuitStatus.HEALTHY)
                    .build();
        });
        when(circuitBreaker.stateOf(anyString(), anyString()))
                .thenAnswer(inv -> CircuitState.healthy(inv.getArgument(0), inv.getArgument(1), START));
    }

    @Test
    void testRoutesToPreferredModel() {
        Policy policy = givenPolicy(Fixtures.policy().taskOverrides(Fixtures.draftingShortOverride()).build());
        RoutingService service = service(defaultCatalog(), Runnable::run);

        RoutingDecision decision = service.routeRequest(request(TaskCategory.DRAFTING_SHORT).build());

        assertEquals("openai", decision.getProvider());
        assertEquals("gpt-4o-mini", decision.getModel());
        assertEquals(0.00045, decision.getEstimatedCost(), 1e-12);
        assertEquals(BudgetStatus.NORMAL, decision.getBudgetStatus());
        assertFalse(decision.isForceCheapest());
        assertFalse(decision.isCacheHit());
        assertNotNull(decision.getReservationId());
        assertTrue(decision.getAlternatives().stream()
                .anyMatch(alt -> alt.getModel().equals("legacy-lite") && alt.isRejected()));

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(1, usage.getInFlight());
        assertEquals(0.00045, usage.getDailyCostUsd(), 1e-12);
        verify(decisionLog).record(decision);
    }

    @Test
    void testPerRequestCapReportedFirst() {
        Policy policy = givenPolicy(Fixtures.policy()
                .maxDailyCostUsd(2.00)
                .maxRequestCostUsd(0.02)
                .sustainedRateLimit(30)
                .build());
        for (int i = 0; i < 100; i++) {
            Reservation prior = budgetGate.checkAndReserve(policy, 0.0199);
            budgetGate.commit(prior.getId(), 0.0199);
        }
        RoutingService service = service(defaultCatalog(), Runnable::run);

        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT).estimatedCostUsd(0.03).build()));

        assertEquals(DenialReason.REQUEST_COST_EXCEEDS_LIMIT, e.getReason());
        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(1.99, usage.getDailyCostUsd(), 1e-9);
        assertEquals(0, usage.getInFlight());
        verify(decisionLog, never()).record(any());
    }

    @Test
    void testPerRequestCapReportedBeforeNoEligibleModel() {
        Policy policy = givenPolicy(Fixtures.policy()
                .maxDailyCostUsd(2.00)
                .maxRequestCostUsd(0.02)
                .maxTokensInput(300_000)
                .maxTokensOutput(300_000)
                .sustainedRateLimit(30)
                .build());
        for (int i = 0; i < 100; i++) {
            Reservation prior = budgetGate.checkAndReserve(policy, 0.0199);
            budgetGate.commit(prior.getId(), 0.0199);
        }
        RoutingService service = service(defaultCatalog(), Runnable::run);

        // legacy-lite, the cheapest allowed model, costs $0.03 for this request
        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT)
                        .estimatedTokensIn(200_000)
                        .estimatedTokensOut(200_000)
                        .build()));

        assertEquals(DenialReason.REQUEST_COST_EXCEEDS_LIMIT, e.getReason());
        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(1.99, usage.getDailyCostUsd(), 1e-9);
        assertEquals(0, usage.getInFlight());
        verify(decisionLog, never()).record(any());
    }

    @Test
    void testDailyBudgetReportedBeforeNoEligibleModel() {
        Policy policy = givenPolicy(Fixtures.policy().maxDailyCostUsd(1.0).build());
        Reservation prior = budgetGate.checkAndReserve(policy, 0.99995);
        budgetGate.commit(prior.getId(), 0.99995);
        RoutingService service = service(defaultCatalog(), Runnable::run);

        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT)
                        .constraints(CallerConstraints.builder().minPerf(0.99).build())
                        .build()));

        assertEquals(DenialReason.DAILY_BUDGET_EXCEEDED, e.getReason());
        assertEquals(0, budgetGate.usage(policy).getInFlight());
    }

    @Test
    void testRateDenialReleasesReservation() {
        Policy policy = givenPolicy(Fixtures.policy().burstRateLimit(1).build());
        RoutingService service = service(defaultCatalog(), Runnable::run);

        RoutingDecision first = service.routeRequest(request(TaskCategory.CHAT).build());
        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT).build()));

        assertEquals(DenialReason.RATE_LIMITED, e.getReason());
        assertNotNull(e.getRetryAfterMs());
        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(1, usage.getInFlight());
        assertEquals(1, usage.getRequestCount());
        assertEquals(first.getEstimatedCost(), usage.getDailyCostUsd(), 1e-12);
        verify(decisionLog, times(1)).record(any());
    }

    @Test
    void testTokenLimitDeniedBeforeReservation() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);

        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT).estimatedTokensIn(200_000).build()));

        assertEquals(DenialReason.TOKEN_LIMIT_EXCEEDED, e.getReason());
        assertEquals(0, budgetGate.usage(policy).getRequestCount());
    }

    @Test
    void testNoEligibleModelReleasesReservation() {
        Policy policy = givenPolicy(Fixtures.policy().allowedProviders(List.of("mistral")).build());
        RoutingService service = service(defaultCatalog(), Runnable::run);

        assertThrows(NoEligibleModelException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT).build()));

        assertEquals(0, budgetGate.usage(policy).getRequestCount());
        assertEquals(0, budgetGate.usage(policy).getInFlight());
        assertTrue(reservations.createdBefore(START.plusSeconds(1)).isEmpty());
    }

    @Test
    void testInvalidRequestRejected() {
        RoutingService service = service(defaultCatalog(), Runnable::run);

        assertThrows(IllegalArgumentException.class,
                () -> service.routeRequest(request(TaskCategory.CHAT).organizationId(" ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.routeRequest(request(null).build()));
    }

    @Test
    void testCriticalBudgetForcesCheapest() {
        Policy policy = givenPolicy(Fixtures.policy().maxRequestCostUsd(10.0).build());
        Reservation prior = budgetGate.checkAndReserve(policy, 9.6);
        budgetGate.commit(prior.getId(), 9.6);
        RoutingService service = service(defaultCatalog(), Runnable::run);

        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        assertEquals(BudgetStatus.CRITICAL, decision.getBudgetStatus());
        assertTrue(decision.isForceCheapest());
        assertTrue(decision.getConstraints().isForceCheapest());
        assertEquals("gpt-4o-mini", decision.getModel());
    }

    @Test
    void testFallsBackToCheapestWhenBudgetCannotCoverSelection() {
        Policy policy = givenPolicy(Fixtures.policy().maxDailyCostUsd(1.0).maxRequestCostUsd(1.0).build());
        Reservation prior = budgetGate.checkAndReserve(policy, 0.75);
        budgetGate.commit(prior.getId(), 0.75);
        observed.put("openai:cheap", new double[]{3000, 0.5});
        observed.put("openai:premium", new double[]{500, 0.0});
        ModelCatalog catalog = new ModelCatalog(List.of(
                spec("openai", "cheap", 0.10, 0.10, 0.55),
                spec("openai", "premium", 100.0, 400.0, 0.95)));
        RoutingService service = service(catalog, Runnable::run);

        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        assertEquals("cheap", decision.getModel());
        assertTrue(decision.isForceCheapest());
        assertEquals(0.00015, decision.getEstimatedCost(), 1e-12);
        assertEquals(0.75015, budgetGate.usage(policy).getDailyCostUsd(), 1e-9);
    }

    @Test
    void testCacheHitSettlesAtServingCost() {
        Policy policy = givenPolicy(Fixtures.policy().taskOverrides(Fixtures.draftingShortOverride()).build());
        when(cacheService.isEnabled()).thenReturn(true);
        when(cacheService.computeKey(any(), anyString(), anyString(), any()))
                .thenAnswer(inv -> inv.getArgument(1) + "/" + inv.getArgument(2));
        when(cacheService.lookup(anyString())).thenAnswer(inv -> {
            String key = inv.getArgument(0);
            return key.equals("anthropic/claude-3-haiku")
                    ? new CacheLookup(true, key, "anthropic", "claude-3-haiku", "cached answer", 3, 0.0009)
                    : CacheLookup.miss(key);
        });
        RoutingService service = service(defaultCatalog(), Runnable::run);

        RoutingDecision decision = service.routeRequest(request(TaskCategory.DRAFTING_SHORT)
                .prompt("Write a haiku about routing")
                .build());

        assertTrue(decision.isCacheHit());
        assertEquals("claude-3-haiku", decision.getModel());
        assertEquals("cached answer", decision.getCachedCompletion());
        assertNull(decision.getReservationId());
        assertEquals(0.0, decision.getEstimatedCost());
        assertEquals(0.0, decision.getFactors().getTotalScore());

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(0, usage.getInFlight());
        assertEquals(1, usage.getRequestCount());
        assertEquals(0.0, usage.getDailyCostUsd(), 1e-12);
        verify(decisionLog).record(decision);
    }

    @Test
    void testReportOutcomeReconcilesAndRecordsTelemetry() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.0004)
                .actualLatencyMs(800)
                .success(true)
                .build());

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(0.0004, usage.getDailyCostUsd(), 1e-12);
        assertEquals(0, usage.getInFlight());

        ArgumentCaptor<TelemetrySample> sample = ArgumentCaptor.forClass(TelemetrySample.class);
        verify(telemetry).record(sample.capture());
        assertEquals("gpt-4o-mini", sample.getValue().getModel());
        assertEquals(800, sample.getValue().getLatencyMs());
        assertTrue(sample.getValue().isSuccess());
        verify(circuitBreaker).evaluate("openai", "gpt-4o-mini");
    }

    @Test
    void testOutcomeReconciledOnAnotherNode() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService admitting = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = admitting.routeRequest(request(TaskCategory.CHAT).build());

        BudgetGate otherGate = new BudgetGate(counters, reservations, policyStore, properties, monotonic);
        DecisionEngine engine = new DecisionEngine(defaultCatalog(), circuitBreaker,
                new CandidateScorer(telemetry, circuitBreaker, properties));
        RoutingService other = new RoutingService(policyStore, otherGate, rateLimiter, engine, cacheService,
                telemetry, circuitBreaker, decisionLog, defaultCatalog(), properties, monotonic, Runnable::run);

        other.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.0004)
                .actualLatencyMs(600)
                .success(true)
                .build());

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(0, usage.getInFlight());
        assertEquals(0.0004, usage.getDailyCostUsd(), 1e-12);
        ArgumentCaptor<TelemetrySample> sample = ArgumentCaptor.forClass(TelemetrySample.class);
        verify(telemetry).record(sample.capture());
        assertEquals("gpt-4o-mini", sample.getValue().getModel());
        assertEquals(0, admitting.settleStaleReservations());
    }

    @Test
    void testReportOutcomeCostFromActualTokens() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualTokensIn(2000)
                .actualTokensOut(1000)
                .actualLatencyMs(900)
                .success(true)
                .build());

        assertEquals(0.0009, budgetGate.usage(policy).getDailyCostUsd(), 1e-12);
    }

    @Test
    void testSuccessfulOutcomeStoresCompletion() {
        givenPolicy(Fixtures.policy().build());
        when(cacheService.isEnabled()).thenReturn(true);
        when(cacheService.computeKey(any(), anyString(), anyString(), any()))
                .thenAnswer(inv -> inv.getArgument(1) + "/" + inv.getArgument(2));
        when(cacheService.lookup(anyString())).thenAnswer(inv -> CacheLookup.miss(inv.getArgument(0)));
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).prompt("hello").build());

        service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.0004)
                .actualTokensIn(1000)
                .actualTokensOut(500)
                .actualLatencyMs(700)
                .success(true)
                .completion("hi there")
                .build());

        verify(cacheService).store("openai/gpt-4o-mini", "openai", "gpt-4o-mini", "hi there", 1000, 500, 0.0004);
    }

    @Test
    void testTimedOutOutcomeCountsAsError() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualLatencyMs(30_000)
                .success(true)
                .timedOut(true)
                .build());

        ArgumentCaptor<TelemetrySample> sample = ArgumentCaptor.forClass(TelemetrySample.class);
        verify(telemetry).record(sample.capture());
        assertFalse(sample.getValue().isSuccess());
        assertEquals(decision.getEstimatedCost(), budgetGate.usage(policy).getDailyCostUsd(), 1e-12);
    }

    @Test
    void testUnknownReservationIgnored() {
        RoutingService service = service(defaultCatalog(), Runnable::run);

        service.reportOutcome(OutcomeReport.builder().reservationId("nope").success(true).build());
        service.reportOutcome(null);

        verify(telemetry, never()).record(any());
    }

    @Test
    void testDuplicateOutcomeIgnored() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());
        OutcomeReport report = OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.001)
                .actualLatencyMs(500)
                .success(true)
                .build();

        service.reportOutcome(report);
        service.reportOutcome(report);

        assertEquals(0.001, budgetGate.usage(policy).getDailyCostUsd(), 1e-12);
        verify(telemetry, times(1)).record(any());
    }

    @Test
    void testTelemetryFailureDoesNotFailOutcome() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());
        doThrow(new IllegalStateException("store down")).when(telemetry).record(any());

        assertDoesNotThrow(() -> service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.001)
                .actualLatencyMs(500)
                .success(true)
                .build()));

        assertEquals(0, budgetGate.usage(policy).getInFlight());
    }

    @Test
    void testStaleReservationsSettledAsErrors() {
        Policy policy = givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        RoutingDecision decision = service.routeRequest(request(TaskCategory.CHAT).build());

        clock.advance(Duration.ofMinutes(11));
        assertEquals(1, service.settleStaleReservations());

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(0, usage.getInFlight());
        assertEquals(decision.getEstimatedCost(), usage.getDailyCostUsd(), 1e-12);

        ArgumentCaptor<TelemetrySample> sample = ArgumentCaptor.forClass(TelemetrySample.class);
        verify(telemetry).record(sample.capture());
        assertFalse(sample.getValue().isSuccess());
        assertEquals(Duration.ofMinutes(11).toMillis(), sample.getValue().getLatencyMs(), 1.0);

        service.reportOutcome(OutcomeReport.builder()
                .reservationId(decision.getReservationId())
                .actualCostUsd(0.5)
                .success(true)
                .build());
        assertEquals(decision.getEstimatedCost(), budgetGate.usage(policy).getDailyCostUsd(), 1e-12);
    }

    @Test
    void testAsyncTimeoutAbandonsDecision() throws Exception {
        Policy policy = givenPolicy(Fixtures.policy().build());
        CountDownLatch gate = new CountDownLatch(1);
        AtomicReference<Thread> worker = new AtomicReference<>();
        Executor delayed = command -> {
            Thread thread = new Thread(() -> {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                command.run();
            });
            worker.set(thread);
            thread.start();
        };
        RoutingService service = service(defaultCatalog(), delayed);

        CompletableFuture<RoutingDecision> result =
                service.routeRequestAsync(request(TaskCategory.CHAT).build(), Duration.ofMillis(50));

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, e.getCause());

        // timeout callbacks run on the delayer thread after get() may already have returned
        Thread.sleep(100);
        gate.countDown();
        worker.get().join(5000);

        UsageSnapshot usage = budgetGate.usage(policy);
        assertEquals(0, usage.getInFlight());
        assertEquals(0, usage.getRequestCount());
        assertEquals(0.0, usage.getDailyCostUsd(), 1e-12);
        ArgumentCaptor<RoutingDecision> recorded = ArgumentCaptor.forClass(RoutingDecision.class);
        verify(decisionLog).record(recorded.capture());
        verify(decisionLog).markAbandoned(recorded.getValue().getDecisionId());
    }

    @Test
    void testAsyncCompletesWithinTimeout() throws Exception {
        givenPolicy(Fixtures.policy().build());
        RoutingService service = service(defaultCatalog(), Runnable::run);

        RoutingDecision decision = service.routeRequestAsync(request(TaskCategory.CHAT).build())
                .get(1, TimeUnit.SECONDS);

        assertEquals("gpt-4o-mini", decision.getModel());
        assertTrue(budgetGate.getReservation(decision.getReservationId()).isPresent());
    }

    @Test
    void testGuardrailStatus() {
        Policy policy = givenPolicy(Fixtures.policy().trial(true).build());
        RoutingService service = service(defaultCatalog(), Runnable::run);
        service.routeRequest(request(TaskCategory.CHAT).build());

        GuardrailStatus status = service.guardrailStatus(policy.getOrganizationId());

        assertTrue(status.isTrial());
        assertEquals(1, status.getUsage().getInFlight());
    }

    private Policy givenPolicy(Policy policy) {
        when(policyStore.getPolicy(policy.getOrganizationId())).thenReturn(policy);
        return policy;
    }

    private RoutingService service(ModelCatalog catalog, Executor executor) {
        DecisionEngine engine = new DecisionEngine(catalog, circuitBreaker,
                new CandidateScorer(telemetry, circuitBreaker, properties));
        return new RoutingService(policyStore, budgetGate, rateLimiter, engine, cacheService, telemetry,
                circuitBreaker, decisionLog, catalog, properties, monotonic, executor);
    }

    private static RoutingRequest.RoutingRequestBuilder request(TaskCategory category) {
        return RoutingRequest.builder()
                .organizationId(Fixtures.ORG)
                .taskCategory(category)
                .estimatedTokensIn(1000)
                .estimatedTokensOut(500);
    }

    private static ModelCatalog defaultCatalog() {
        return new ModelCatalog(List.of(
                spec("openai", "gpt-4o", 5.00, 15.00, 0.92),
                spec("openai", "gpt-4o-mini", 0.15, 0.60, 0.78),
                spec("anthropic", "claude-3-haiku", 0.25, 1.25, 0.70),
                spec("openai", "legacy-lite", 0.05, 0.10, 0.40)));
    }

    private static ModelSpec spec(String provider, String model, double input, double output, double quality) {
        return ModelSpec.builder()
                .provider(provider)
                .model(model)
                .inputPricePerMillion(input)
                .outputPricePerMillion(output)
                .quality(quality)
                .categoryQuality(Map.of())
                .taskCategories(Set.of())
                .build();
    }
}
