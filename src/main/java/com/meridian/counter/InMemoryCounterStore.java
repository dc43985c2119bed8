package com.meridian.counter;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-node counter store. Each key is updated inside {@link ConcurrentMap#compute}, which
 * serializes writers per key without a global lock.
 */
@Slf4j
public class InMemoryCounterStore implements CounterStore {

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final MonotonicClock clock;

    public InMemoryCounterStore(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public CounterResult addIfWithin(String key, double delta, double ceiling, Duration ttl) {
        long now = clock.millis();
        CounterResult[] result = new CounterResult[1];

        counters.compute(key, (k, existing) -> {
            double current = live(existing, now) ? existing.value : 0.0;
            if (current + delta > ceiling + CounterResult.EPSILON) {
                result[0] = CounterResult.rejected(current);
                return live(existing, now) ? existing : null;
            }
            double updated = current + delta;
            result[0] = CounterResult.applied(updated);
            return new Counter(updated, now + ttl.toMillis());
        });

        return result[0];
    }

    @Override
    public double add(String key, double delta, Duration ttl) {
        long now = clock.millis();
        Counter updated = counters.compute(key, (k, existing) -> {
            double current = live(existing, now) ? existing.value : 0.0;
            return new Counter(current + delta, now + ttl.toMillis());
        });
        return updated.value;
    }

    @Override
    public double get(String key) {
        Counter counter = counters.get(key);
        return live(counter, clock.millis()) ? counter.value : 0.0;
    }

    @Override
    public void delete(String key) {
        counters.remove(key);
    }

    /**
     * Drop expired counters.
     *
     * @return number of counters removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        int before = counters.size();
        counters.entrySet().removeIf(e -> !live(e.getValue(), now));
        int removed = before - counters.size();
        if (removed > 0) {
            log.debug("Purged {} expired counters", removed);
        }
        return removed;
    }

    private static boolean live(Counter counter, long now) {
        return counter != null && counter.expiresAt > now;
    }

    private record Counter(double value, long expiresAt) {
    }
}
