package com.meridian.counter;

import java.time.Duration;

/**
 * Atomic numeric counters keyed by string.
 *
 * <p>All guardrail state (daily spend, in-flight jobs, rate windows) goes through this interface,
 * so the budget and rate logic stays independent of where the counters live.
 */
public interface CounterStore {

    /**
     * Atomically add {@code delta} unless the result would exceed {@code ceiling}.
     *
     * @param key     counter key
     * @param delta   amount to add (positive)
     * @param ceiling inclusive upper bound for the resulting value
     * @param ttl     expiry applied when the counter is written
     * @return whether the increment was applied, and the counter value afterwards
     */
    CounterResult addIfWithin(String key, double delta, double ceiling, Duration ttl);

    /**
     * Unconditionally add {@code delta} (may be negative).
     *
     * @return value after the update
     */
    double add(String key, double delta, Duration ttl);

    /**
     * Current value, 0 when absent or expired.
     */
    double get(String key);

    void delete(String key);
}
