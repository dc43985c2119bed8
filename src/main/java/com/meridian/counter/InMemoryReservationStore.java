package com.meridian.counter;

import com.meridian.model.Reservation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-node reservation store.
 */
public class InMemoryReservationStore implements ReservationStore {

    private final ConcurrentMap<String, Entry> reservations = new ConcurrentHashMap<>();
    private final MonotonicClock clock;

    public InMemoryReservationStore(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public void save(Reservation reservation, Duration ttl) {
        reservations.put(reservation.getId(), new Entry(reservation, clock.millis() + ttl.toMillis()));
    }

    @Override
    public boolean replace(Reservation reservation, Duration ttl) {
        long now = clock.millis();
        Entry updated = reservations.computeIfPresent(reservation.getId(),
                (id, existing) -> existing.expiresAt > now ? new Entry(reservation, now + ttl.toMillis()) : null);
        return updated != null;
    }

    @Override
    public Optional<Reservation> find(String reservationId) {
        Entry entry = reservations.get(reservationId);
        return entry != null && entry.expiresAt > clock.millis()
                ? Optional.of(entry.reservation) : Optional.empty();
    }

    @Override
    public Optional<Reservation> remove(String reservationId) {
        Entry entry = reservations.remove(reservationId);
        return entry != null && entry.expiresAt > clock.millis()
                ? Optional.of(entry.reservation) : Optional.empty();
    }

    @Override
    public List<Reservation> createdBefore(Instant cutoff) {
        long now = clock.millis();
        reservations.values().removeIf(entry -> entry.expiresAt <= now);

        List<Reservation> result = new ArrayList<>();
        for (Entry entry : reservations.values()) {
            if (entry.reservation.getCreatedAt().isBefore(cutoff)) {
                result.add(entry.reservation);
            }
        }
        result.sort(Comparator.comparing(Reservation::getCreatedAt));
        return result;
    }

    private record Entry(Reservation reservation, long expiresAt) {
    }
}
