package com.meridian.counter;

import com.meridian.model.BudgetStatus;
import com.meridian.model.Reservation;
import com.meridian.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryReservationStore.
 */
class InMemoryReservationStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration TTL = Duration.ofHours(1);

    private MutableClock clock;
    private InMemoryReservationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryReservationStore(new MonotonicClock(clock));
    }

    @Test
    void testRemoveClaimsOnce() {
        store.save(reservation("r-1", START), TTL);

        assertTrue(store.remove("r-1").isPresent());
        assertTrue(store.remove("r-1").isEmpty());
        assertTrue(store.find("r-1").isEmpty());
    }

    @Test
    void testReplaceOnlyExisting() {
        assertFalse(store.replace(reservation("r-1", START), TTL));

        store.save(reservation("r-1", START), TTL);
        assertTrue(store.replace(reservation("r-1", START).withEstimate(0.3, BudgetStatus.WARNING), TTL));

        Reservation stored = store.find("r-1").orElseThrow();
        assertEquals(0.3, stored.getEstimatedCost(), 1e-9);
        assertEquals(BudgetStatus.WARNING, stored.getBudgetStatus());
    }

    @Test
    void testExpiredReservationIsGone() {
        store.save(reservation("r-1", START), TTL);
        clock.advance(TTL.plusSeconds(1));

        assertTrue(store.find("r-1").isEmpty());
        assertFalse(store.replace(reservation("r-1", START), TTL));
        assertTrue(store.remove("r-1").isEmpty());
    }

    @Test
    void testCreatedBeforeOrderedByAge() {
        store.save(reservation("newer", START.plusSeconds(60)), TTL);
        store.save(reservation("older", START), TTL);
        store.save(reservation("fresh", START.plusSeconds(600)), TTL);

        List<Reservation> stale = store.createdBefore(START.plusSeconds(300));

        assertEquals(List.of("older", "newer"), stale.stream().map(Reservation::getId).toList());
    }

    private static Reservation reservation(String id, Instant createdAt) {
        return Reservation.builder()
                .id(id)
                .organizationId("org-1")
                .day(LocalDate.of(2026, 3, 1))
                .estimatedCost(0.1)
                .createdAt(createdAt)
                .budgetStatus(BudgetStatus.NORMAL)
                .build();
    }
}
