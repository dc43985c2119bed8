package com.meridian.counter;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall clock that never moves backwards.
 *
 * <p>Window boundaries are derived from epoch milliseconds so that several nodes sharing a
 * counter store agree on them; a backwards step of the system clock is absorbed by holding
 * the last observed value until real time catches up.
 */
public class MonotonicClock {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    public static MonotonicClock system() {
        return new MonotonicClock(Clock.systemUTC());
    }

    public long millis() {
        return last.accumulateAndGet(clock.millis(), Math::max);
    }

    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }
}
