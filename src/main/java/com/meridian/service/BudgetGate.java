package com.meridian.service;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.CounterResult;
import com.meridian.counter.CounterStore;
import com.meridian.counter.MonotonicClock;
import com.meridian.counter.ReservationStore;
import com.meridian.exception.AdmissionDeniedException;
import com.meridian.model.BudgetStatus;
import com.meridian.model.DenialReason;
import com.meridian.model.Policy;
import com.meridian.model.Reservation;
import com.meridian.model.UsageSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Daily usage ledger and admission gate.
 *
 * <p>Checks run in a fixed order and the first failure is reported: per-request cap,
 * concurrency ceiling, daily budget. The in-flight and daily cost counters are taken with the
 * counter store's conditional increment, so concurrent requests cannot jointly pass a ceiling.
 * Reservations live in the {@link ReservationStore} next to the counters, so they are settled by
 * {@link #commit} or undone by {@link #release} on whichever node receives the outcome.
 */
@Slf4j
@Service
public class BudgetGate {

    private final CounterStore counters;
    private final ReservationStore reservations;
    private final PolicyStore policyStore;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    public BudgetGate(CounterStore counters, ReservationStore reservations, PolicyStore policyStore,
                      MeridianProperties properties, MonotonicClock clock) {
        this.counters = counters;
        this.reservations = reservations;
        this.policyStore = policyStore;
        this.properties = properties;
        this.clock = clock;
    }

    public Reservation checkAndReserve(String organizationId, double estimatedCost) {
        return checkAndReserve(policyStore.getPolicy(organizationId), estimatedCost);
    }

    /**
     * Reserve budget and a concurrency slot for one request.
     *
     * @throws AdmissionDeniedException RequestCostExceedsLimit, ConcurrencyLimitExceeded or DailyBudgetExceeded
     */
    public Reservation checkAndReserve(Policy policy, double estimatedCost) {
        String org = policy.getOrganizationId();
        Duration ttl = properties.getBudget().getCounterTtl();

        if (estimatedCost > policy.getMaxRequestCostUsd() + CounterResult.EPSILON) {
            throw deny(org, DenialReason.REQUEST_COST_EXCEEDS_LIMIT, String.format(
                    "Estimated cost $%.6f exceeds per-request limit $%.6f", estimatedCost, policy.getMaxRequestCostUsd()));
        }

        CounterResult slot = counters.addIfWithin(inFlightKey(org), 1, policy.getMaxConcurrentJobs(), ttl);
        if (!slot.applied()) {
            throw deny(org, DenialReason.CONCURRENCY_LIMIT_EXCEEDED, String.format(
                    "%d requests already in flight (limit %d)", (long) slot.value(), policy.getMaxConcurrentJobs()));
        }

        LocalDate day = today();
        CounterResult cost = counters.addIfWithin(costKey(org, day), estimatedCost, policy.getMaxDailyCostUsd(), ttl);
        if (!cost.applied()) {
            counters.add(inFlightKey(org), -1, ttl);
            throw deny(org, DenialReason.DAILY_BUDGET_EXCEEDED, String.format(
                    "Daily spend $%.6f + estimate $%.6f exceeds daily budget $%.2f",
                    cost.value(), estimatedCost, policy.getMaxDailyCostUsd()));
        }
        counters.add(requestsKey(org, day), 1, ttl);

        Reservation reservation = Reservation.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(org)
                .day(day)
                .estimatedCost(estimatedCost)
                .createdAt(clock.instant())
                .budgetStatus(status(cost.value(), policy.getMaxDailyCostUsd()))
                .build();
        reservations.save(reservation, ttl);

        log.debug("Reserved ${} for org={} reservation={} status={}",
                estimatedCost, org, reservation.getId(), reservation.getBudgetStatus());
        return reservation;
    }

    /**
     * Move a reservation to a new estimate. Increases are conditional on the daily budget,
     * decreases always apply. On denial the reservation keeps its previous estimate.
     *
     * @throws AdmissionDeniedException RequestCostExceedsLimit or DailyBudgetExceeded
     */
    public Reservation adjust(Policy policy, String reservationId, double newEstimate) {
        Reservation reservation = reservations.find(reservationId)
                .orElseThrow(() -> new IllegalStateException("Unknown reservation " + reservationId));

        String org = reservation.getOrganizationId();
        Duration ttl = properties.getBudget().getCounterTtl();
        double delta = newEstimate - reservation.getEstimatedCost();
        double spent;

        if (delta > CounterResult.EPSILON) {
            if (newEstimate > policy.getMaxRequestCostUsd() + CounterResult.EPSILON) {
                throw deny(org, DenialReason.REQUEST_COST_EXCEEDS_LIMIT, String.format(
                        "Estimated cost $%.6f exceeds per-request limit $%.6f", newEstimate, policy.getMaxRequestCostUsd()));
            }
            CounterResult result = counters.addIfWithin(costKey(org, reservation.getDay()), delta,
                    policy.getMaxDailyCostUsd(), ttl);
            if (!result.applied()) {
                throw deny(org, DenialReason.DAILY_BUDGET_EXCEEDED, String.format(
                        "Daily spend $%.6f + estimate $%.6f exceeds daily budget $%.2f",
                        result.value(), newEstimate, policy.getMaxDailyCostUsd()));
            }
            spent = result.value();
        } else if (delta < -CounterResult.EPSILON) {
            spent = counters.add(costKey(org, reservation.getDay()), delta, ttl);
        } else {
            return reservation;
        }

        Reservation adjusted = reservation.withEstimate(newEstimate, status(spent, policy.getMaxDailyCostUsd()));
        if (!reservations.replace(adjusted, ttl)) {
            counters.add(costKey(org, reservation.getDay()), -delta, ttl);
            throw new IllegalStateException("Reservation " + reservationId + " was settled while being adjusted");
        }
        return adjusted;
    }

    /**
     * Attach the selected route to an open reservation.
     */
    public Reservation attachRoute(String reservationId, String decisionId, String provider, String model,
                                   String cacheKey) {
        Reservation routed = reservations.find(reservationId)
                .orElseThrow(() -> new IllegalStateException("Unknown reservation " + reservationId))
                .withRoute(decisionId, provider, model, cacheKey);
        if (!reservations.replace(routed, properties.getBudget().getCounterTtl())) {
            throw new IllegalStateException("Reservation " + reservationId + " was settled before routing finished");
        }
        return routed;
    }

    /**
     * Reconcile a reservation with the actual cost and free its concurrency slot. The difference
     * is refunded or debited unconditionally.
     *
     * @return the settled reservation, empty if it was unknown or already settled
     */
    public Optional<Reservation> commit(String reservationId, double actualCost) {
        Optional<Reservation> reservation = reservations.remove(reservationId);
        if (reservation.isEmpty()) {
            log.warn("Commit for unknown reservation {} ignored", reservationId);
            return Optional.empty();
        }
        settle(reservation.get(), actualCost);
        return reservation;
    }

    /**
     * Settle at the current estimate, used when the actual cost is unknown.
     */
    public Optional<Reservation> commitWithEstimate(String reservationId) {
        Optional<Reservation> reservation = reservations.remove(reservationId);
        if (reservation.isEmpty()) {
            log.warn("Commit for unknown reservation {} ignored", reservationId);
            return Optional.empty();
        }
        settle(reservation.get(), reservation.get().getEstimatedCost());
        return reservation;
    }

    /**
     * Undo a reservation whose request never ran.
     */
    public Optional<Reservation> release(String reservationId) {
        Optional<Reservation> removed = reservations.remove(reservationId);
        if (removed.isEmpty()) {
            return Optional.empty();
        }

        Reservation reservation = removed.get();
        Duration ttl = properties.getBudget().getCounterTtl();
        String org = reservation.getOrganizationId();
        counters.add(costKey(org, reservation.getDay()), -reservation.getEstimatedCost(), ttl);
        counters.add(requestsKey(org, reservation.getDay()), -1, ttl);
        counters.add(inFlightKey(org), -1, ttl);

        log.info("Released reservation {} for org={} (${})", reservationId, org, reservation.getEstimatedCost());
        return removed;
    }

    /**
     * Settle reservations older than {@code maxAge} at their estimate.
     *
     * @return the reservations that were settled
     */
    public List<Reservation> sweepStaleReservations(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<Reservation> settled = new ArrayList<>();
        for (Reservation stale : reservations.createdBefore(cutoff)) {
            // another node may have settled it in the meantime
            reservations.remove(stale.getId()).ifPresent(reservation -> {
                settle(reservation, reservation.getEstimatedCost());
                settled.add(reservation);
            });
        }
        if (!settled.isEmpty()) {
            log.warn("Settled {} stale reservations older than {}", settled.size(), maxAge);
        }
        return settled;
    }

    public Optional<Reservation> getReservation(String reservationId) {
        return reservations.find(reservationId);
    }

    public UsageSnapshot usage(String organizationId) {
        return usage(policyStore.getPolicy(organizationId));
    }

    /**
     * Today's usage. Status is derived on every read.
     */
    public UsageSnapshot usage(Policy policy) {
        String org = policy.getOrganizationId();
        LocalDate day = today();
        double spent = counters.get(costKey(org, day));
        double max = policy.getMaxDailyCostUsd();

        return UsageSnapshot.builder()
                .organizationId(org)
                .day(day)
                .dailyCostUsd(spent)
                .requestCount((long) counters.get(requestsKey(org, day)))
                .inFlight((long) counters.get(inFlightKey(org)))
                .maxDailyCostUsd(max)
                .remainingUsd(Math.max(0.0, max - spent))
                .usagePercent(max > 0 ? spent / max * 100.0 : 0.0)
                .status(status(spent, max))
                .build();
    }

    private void settle(Reservation reservation, double actualCost) {
        Duration ttl = properties.getBudget().getCounterTtl();
        String org = reservation.getOrganizationId();
        double delta = actualCost - reservation.getEstimatedCost();
        if (Math.abs(delta) > CounterResult.EPSILON) {
            counters.add(costKey(org, reservation.getDay()), delta, ttl);
        }
        counters.add(inFlightKey(org), -1, ttl);

        log.debug("Committed reservation {} for org={} estimate=${} actual=${}",
                reservation.getId(), org, reservation.getEstimatedCost(), actualCost);
    }

    private BudgetStatus status(double spent, double max) {
        double ratio = max > 0 ? spent / max : 1.0;
        return BudgetStatus.of(ratio, properties.getBudget().getWarningThreshold(),
                properties.getBudget().getCriticalThreshold());
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private AdmissionDeniedException deny(String org, DenialReason reason, String message) {
        log.warn("Admission denied org={} reason={} at={}: {}", org, reason, clock.instant(), message);
        return new AdmissionDeniedException(org, reason, message);
    }

    static String costKey(String org, LocalDate day) {
        return "usage:" + org + ":" + day + ":cost";
    }

    static String requestsKey(String org, LocalDate day) {
        return "usage:" + org + ":" + day + ":requests";
    }

    static String inFlightKey(String org) {
        return "inflight:" + org;
    }
}
