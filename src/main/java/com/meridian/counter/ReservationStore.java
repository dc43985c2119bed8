package com.meridian.counter;

import com.meridian.model.Reservation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Open reservations, kept next to the counters they debit so that commit, release and the
 * stale sweep work from any node.
 */
public interface ReservationStore {

    void save(Reservation reservation, Duration ttl);

    /**
     * Overwrite a reservation that is still open.
     *
     * @return false if it was already settled or expired
     */
    boolean replace(Reservation reservation, Duration ttl);

    Optional<Reservation> find(String reservationId);

    /**
     * Atomically take a reservation out of the store. At most one caller receives it.
     */
    Optional<Reservation> remove(String reservationId);

    /**
     * Open reservations created before {@code cutoff}.
     */
    List<Reservation> createdBefore(Instant cutoff);
}
