package com.meridian.service;

import com.meridian.config.ExecutorConfiguration;
import com.meridian.config.MeridianProperties;
import com.meridian.counter.MonotonicClock;
import com.meridian.exception.AdmissionDeniedException;
import com.meridian.model.CallerConstraints;
import com.meridian.model.DenialReason;
import com.meridian.model.ModelSpec;
import com.meridian.model.OutcomeReport;
import com.meridian.model.Policy;
import com.meridian.model.Reservation;
import com.meridian.model.RoutingDecision;
import com.meridian.model.RoutingRequest;
import com.meridian.model.ScoreFactors;
import com.meridian.model.TaskCategory;
import com.meridian.model.TelemetrySample;
import com.meridian.model.dto.GuardrailStatus;
import com.meridian.service.cache.CacheLookup;
import com.meridian.service.cache.ResponseCacheService;
import com.meridian.service.routing.CandidateSet;
import com.meridian.service.routing.DecisionEngine;
import com.meridian.service.routing.Selection;
import com.meridian.service.telemetry.CircuitBreakerService;
import com.meridian.service.telemetry.TelemetryAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for routing requests and outcome reports.
 *
 * Flow:
 * 1. Load policy, check token ceilings, build the candidate set
 * 2. Admission: budget reservation sized on the cheapest allowed model (or the caller's
 *    estimate), then rate limit; any later failure releases the reservation
 * 3. No eligible model is reported only after admission has passed
 * 4. Response cache lookup across eligible candidates
 * 5. Model selection, forced to the cheapest model under budget pressure
 * 6. Route attached to the reservation and decision logged; the caller performs the provider
 *    call and reports the outcome, on any node
 */
@Slf4j
@Service
public class RoutingService {

    private final PolicyStore policyStore;
    private final BudgetGate budgetGate;
    private final RateLimiter rateLimiter;
    private final DecisionEngine decisionEngine;
    private final ResponseCacheService cacheService;
    private final TelemetryAggregator telemetry;
    private final CircuitBreakerService circuitBreaker;
    private final DecisionLogService decisionLog;
    private final ModelCatalog catalog;
    private final MeridianProperties properties;
    private final MonotonicClock clock;
    private final Executor executor;

    public RoutingService(
            PolicyStore policyStore,
            BudgetGate budgetGate,
            RateLimiter rateLimiter,
            DecisionEngine decisionEngine,
            ResponseCacheService cacheService,
            TelemetryAggregator telemetry,
            CircuitBreakerService circuitBreaker,
            DecisionLogService decisionLog,
            ModelCatalog catalog,
            MeridianProperties properties,
            MonotonicClock clock,
            @Qualifier(ExecutorConfiguration.ROUTING_EXECUTOR) Executor executor) {
        this.policyStore = policyStore;
        this.budgetGate = budgetGate;
        this.rateLimiter = rateLimiter;
        this.decisionEngine = decisionEngine;
        this.cacheService = cacheService;
        this.telemetry = telemetry;
        this.circuitBreaker = circuitBreaker;
        this.decisionLog = decisionLog;
        this.catalog = catalog;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Admit a request and select the model that serves it.
     *
     * @throws AdmissionDeniedException when a guardrail refuses the request
     * @throws com.meridian.exception.NoEligibleModelException when every candidate is filtered out
     * @throws com.meridian.exception.PolicyNotFoundException when the organization has no policy
     */
    public RoutingDecision routeRequest(RoutingRequest request) {
        validate(request);
        String org = request.getOrganizationId();
        TaskCategory category = request.getTaskCategory();
        CallerConstraints caller = request.getConstraints() != null
                ? request.getConstraints() : CallerConstraints.builder().build();

        Policy policy = policyStore.getPolicy(org);
        checkTokenLimits(policy, request);

        CandidateSet candidates = decisionEngine.candidates(policy, category,
                request.getEstimatedTokensIn(), request.getEstimatedTokensOut(), caller);

        boolean callerEstimate = request.getEstimatedCostUsd() != null;
        double admissionEstimate = callerEstimate
                ? request.getEstimatedCostUsd()
                : candidates.cheapestAllowedCost();

        Reservation reservation = budgetGate.checkAndReserve(policy, admissionEstimate);
        try {
            rateLimiter.enforce(policy);
            decisionEngine.requireEligible(policy, candidates);

            boolean forceCheapest = caller.isForceCheapest()
                    || reservation.getBudgetStatus().isAtLeast(properties.getRouting().getForceCheapestAt());

            RoutingDecision cached = tryCache(request, candidates, reservation, forceCheapest);
            if (cached != null) {
                return cached;
            }

            Selection selection = decisionEngine.select(candidates, forceCheapest);
            if (!callerEstimate) {
                try {
                    reservation = budgetGate.adjust(policy, reservation.getId(), selection.selected().estimatedCost());
                } catch (AdmissionDeniedException e) {
                    if (forceCheapest) {
                        throw e;
                    }
                    log.warn("Budget cannot cover {} for org={}, falling back to cheapest model",
                            selection.selected().key(), org);
                    forceCheapest = true;
                    selection = decisionEngine.select(candidates, true);
                    reservation = budgetGate.adjust(policy, reservation.getId(), selection.selected().estimatedCost());
                }
            }

            ModelSpec selected = selection.selected().spec();
            String cacheKey = request.getPrompt() != null && cacheService.isEnabled()
                    ? cacheService.computeKey(request.getPrompt(), selected.getProvider(), selected.getModel(),
                    request.getParameters())
                    : null;

            RoutingDecision decision = RoutingDecision.builder()
                    .decisionId(UUID.randomUUID().toString())
                    .reservationId(reservation.getId())
                    .organizationId(org)
                    .timestamp(clock.instant())
                    .taskCategory(category)
                    .provider(selected.getProvider())
                    .model(selected.getModel())
                    .estimatedCost(reservation.getEstimatedCost())
                    .factors(selection.selected().factors())
                    .alternatives(selection.alternatives())
                    .constraints(selection.constraints())
                    .telemetry(selection.selected().telemetry())
                    .budgetStatus(reservation.getBudgetStatus())
                    .forceCheapest(forceCheapest)
                    .cacheHit(false)
                    .cacheKey(cacheKey)
                    .reason(selection.reason())
                    .build();

            budgetGate.attachRoute(reservation.getId(), decision.getDecisionId(),
                    selected.getProvider(), selected.getModel(), cacheKey);
            decisionLog.record(decision);
            return decision;

        } catch (RuntimeException e) {
            budgetGate.release(reservation.getId());
            throw e;
        }
    }

    /**
     * Route on the routing executor. If the caller's future times out, the reservation the
     * work eventually produces is released and its decision is marked abandoned.
     */
    public CompletableFuture<RoutingDecision> routeRequestAsync(RoutingRequest request, Duration timeout) {
        CompletableFuture<RoutingDecision> work = CompletableFuture.supplyAsync(() -> routeRequest(request), executor);
        CompletableFuture<RoutingDecision> result = work.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        result.whenComplete((decision, error) -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                log.warn("Admission for org={} timed out after {}; abandoning the decision it produces",
                        request.getOrganizationId(), timeout);
                work.thenAccept(this::abandon);
            }
        });
        return result;
    }

    public CompletableFuture<RoutingDecision> routeRequestAsync(RoutingRequest request) {
        return routeRequestAsync(request, properties.getRouting().getAdmissionTimeout());
    }

    /**
     * Reconcile budget and record telemetry for a completed provider call. Never throws for
     * telemetry or ledger failures; unknown reservations are logged and ignored.
     */
    public void reportOutcome(OutcomeReport report) {
        if (report == null || report.getReservationId() == null) {
            log.warn("Outcome report without reservation id ignored");
            return;
        }
        Optional<Reservation> open = budgetGate.getReservation(report.getReservationId());
        if (open.isEmpty() || !open.get().isRouted()) {
            log.warn("Outcome for unknown or settled reservation {} ignored", report.getReservationId());
            return;
        }

        Reservation route = open.get();
        String provider = report.getProvider() != null ? report.getProvider() : route.getProvider();
        String model = report.getModel() != null ? report.getModel() : route.getModel();
        boolean success = report.isSuccess() && !report.isTimedOut();
        double cost = actualCost(report, route, provider, model);

        try {
            if (budgetGate.commit(report.getReservationId(), cost).isEmpty()) {
                log.warn("Reservation {} was settled concurrently, outcome ignored", report.getReservationId());
                return;
            }
        } catch (RuntimeException e) {
            log.error("Failed to reconcile reservation {} for org={}", report.getReservationId(), route.getOrganizationId(), e);
        }

        recordTelemetry(TelemetrySample.builder()
                .provider(provider)
                .model(model)
                .timestamp(clock.instant())
                .latencyMs(report.getActualLatencyMs())
                .success(success)
                .costUsd(cost)
                .build());

        if (!success) {
            log.warn("Provider call failed org={} model={}:{} timedOut={} reservation={}",
                    route.getOrganizationId(), provider, model, report.isTimedOut(), report.getReservationId());
        } else if (report.getCompletion() != null && route.getCacheKey() != null) {
            cacheService.store(route.getCacheKey(), provider, model, report.getCompletion(),
                    report.getActualTokensIn(), report.getActualTokensOut(), cost);
        }
    }

    /**
     * Settle reservations whose outcome never arrived: commit at the estimate and count the
     * call as a timed-out error sample.
     *
     * @return number of reservations settled
     */
    public int settleStaleReservations() {
        Duration maxAge = properties.getBudget().getReservationTimeout();
        List<Reservation> settled = budgetGate.sweepStaleReservations(maxAge);
        Instant now = clock.instant();

        for (Reservation reservation : settled) {
            if (!reservation.isRouted()) {
                continue;
            }
            log.warn("No outcome for reservation {} org={} model={}:{} after {}, settled at estimate ${}",
                    reservation.getId(), reservation.getOrganizationId(), reservation.getProvider(),
                    reservation.getModel(), maxAge, reservation.getEstimatedCost());
            recordTelemetry(TelemetrySample.builder()
                    .provider(reservation.getProvider())
                    .model(reservation.getModel())
                    .timestamp(now)
                    .latencyMs(Duration.between(reservation.getCreatedAt(), now).toMillis())
                    .success(false)
                    .costUsd(reservation.getEstimatedCost())
                    .build());
        }
        return settled.size();
    }

    /**
     * Budget and rate window usage for an organization.
     */
    public GuardrailStatus guardrailStatus(String organizationId) {
        Policy policy = policyStore.getPolicy(organizationId);
        return GuardrailStatus.builder()
                .usage(budgetGate.usage(policy))
                .rate(rateLimiter.status(policy))
                .trial(policy.isTrial())
                .build();
    }

    private RoutingDecision tryCache(RoutingRequest request, CandidateSet candidates, Reservation reservation,
                                     boolean forceCheapest) {
        if (!cacheService.isEnabled() || request.getPrompt() == null) {
            return null;
        }
        for (ModelSpec spec : candidates.eligible()) {
            String key = cacheService.computeKey(request.getPrompt(), spec.getProvider(), spec.getModel(),
                    request.getParameters());
            CacheLookup lookup = cacheService.lookup(key);
            if (!lookup.hit()) {
                continue;
            }

            double servingCost = properties.getCache().getNominalServingCostUsd();
            budgetGate.commit(reservation.getId(), servingCost);

            RoutingDecision decision = RoutingDecision.builder()
                    .decisionId(UUID.randomUUID().toString())
                    .organizationId(request.getOrganizationId())
                    .timestamp(clock.instant())
                    .taskCategory(request.getTaskCategory())
                    .provider(spec.getProvider())
                    .model(spec.getModel())
                    .estimatedCost(servingCost)
                    .factors(ScoreFactors.zero())
                    .constraints(candidates.constraints().toBuilder().forceCheapest(forceCheapest).build())
                    .budgetStatus(reservation.getBudgetStatus())
                    .forceCheapest(forceCheapest)
                    .cacheHit(true)
                    .cacheKey(key)
                    .cachedCompletion(lookup.completion())
                    .reason(String.format("Served from response cache (hit %d), saving an estimated $%.6f",
                            lookup.hitCount(), lookup.estimatedCost()))
                    .build();
            decisionLog.record(decision);
            return decision;
        }
        return null;
    }

    private void abandon(RoutingDecision decision) {
        if (decision.getReservationId() != null) {
            budgetGate.release(decision.getReservationId());
        }
        try {
            decisionLog.markAbandoned(decision.getDecisionId());
        } catch (RuntimeException e) {
            log.error("Failed to mark decision {} abandoned", decision.getDecisionId(), e);
        }
    }

    private double actualCost(OutcomeReport report, Reservation route, String provider, String model) {
        if (report.getActualCostUsd() != null) {
            return report.getActualCostUsd();
        }
        if (report.getActualTokensIn() != null && report.getActualTokensOut() != null) {
            return catalog.find(provider, model)
                    .map(spec -> spec.estimateCost(report.getActualTokensIn(), report.getActualTokensOut()))
                    .orElse(route.getEstimatedCost());
        }
        return route.getEstimatedCost();
    }

    private void recordTelemetry(TelemetrySample sample) {
        try {
            telemetry.record(sample);
            circuitBreaker.evaluate(sample.getProvider(), sample.getModel());
        } catch (RuntimeException e) {
            log.error("Failed to record telemetry for {}", sample.key(), e);
        }
    }

    private void checkTokenLimits(Policy policy, RoutingRequest request) {
        if (request.getEstimatedTokensIn() > policy.getMaxTokensInput()) {
            throw tokenDenial(policy, "input", request.getEstimatedTokensIn(), policy.getMaxTokensInput());
        }
        if (request.getEstimatedTokensOut() > policy.getMaxTokensOutput()) {
            throw tokenDenial(policy, "output", request.getEstimatedTokensOut(), policy.getMaxTokensOutput());
        }
    }

    private AdmissionDeniedException tokenDenial(Policy policy, String direction, int requested, int limit) {
        log.warn("Admission denied org={} reason={} at={}: {} tokens {} > {}",
                policy.getOrganizationId(), DenialReason.TOKEN_LIMIT_EXCEEDED, clock.instant(), direction, requested, limit);
        return new AdmissionDeniedException(policy.getOrganizationId(), DenialReason.TOKEN_LIMIT_EXCEEDED,
                String.format("Estimated %s tokens %d exceed limit %d", direction, requested, limit));
    }

    private static void validate(RoutingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Routing request is required");
        }
        if (request.getOrganizationId() == null || request.getOrganizationId().isBlank()) {
            throw new IllegalArgumentException("organizationId is required");
        }
        if (request.getTaskCategory() == null) {
            throw new IllegalArgumentException("taskCategory is required");
        }
        if (request.getEstimatedTokensIn() < 0 || request.getEstimatedTokensOut() < 0) {
            throw new IllegalArgumentException("Token estimates must not be negative");
        }
        if (request.getEstimatedCostUsd() != null && request.getEstimatedCostUsd() < 0) {
            throw new IllegalArgumentException("estimatedCostUsd must not be negative");
        }
    }
}
