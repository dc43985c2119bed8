package com.meridian.config;

import com.meridian.counter.InMemoryCounterStore;
import com.meridian.counter.InMemoryReservationStore;
import com.meridian.counter.MonotonicClock;
import com.meridian.counter.ReservationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock, counter store and reservation store beans. The Redis stores replace the in-memory ones when
 * {@code meridian.counters.backend=redis} (see {@link RedisConfiguration}).
 */
@Slf4j
@Configuration
public class CounterStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock monotonicClock(Clock clock) {
        return new MonotonicClock(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "meridian.counters", name = "backend", havingValue = "memory", matchIfMissing = true)
    public InMemoryCounterStore inMemoryCounterStore(MonotonicClock monotonicClock) {
        log.info("Using in-memory counter store (single node)");
        return new InMemoryCounterStore(monotonicClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "meridian.counters", name = "backend", havingValue = "memory", matchIfMissing = true)
    public ReservationStore inMemoryReservationStore(MonotonicClock monotonicClock) {
        return new InMemoryReservationStore(monotonicClock);
    }
}
