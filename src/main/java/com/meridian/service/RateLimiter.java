package com.meridian.service;

import com.meridian.config.MeridianProperties;
import com.meridian.counter.CounterResult;
import com.meridian.counter.CounterStore;
import com.meridian.counter.MonotonicClock;
import com.meridian.exception.AdmissionDeniedException;
import com.meridian.model.DenialReason;
import com.meridian.model.Policy;
import com.meridian.model.RateDecision;
import com.meridian.model.RateLimitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Burst and sustained fixed-window rate limits per organization.
 *
 * <p>Windows are keyed by {@code millis / windowMillis} from a monotonic clock, so rollover is
 * a new key rather than a reset, and a backwards clock step cannot reopen a spent window.
 */
@Slf4j
@Service
public class RateLimiter {

    static final String BURST = "burst";
    static final String SUSTAINED = "sustained";

    private final CounterStore counters;
    private final PolicyStore policyStore;
    private final MeridianProperties properties;
    private final MonotonicClock clock;

    public RateLimiter(CounterStore counters, PolicyStore policyStore, MeridianProperties properties,
                       MonotonicClock clock) {
        this.counters = counters;
        this.policyStore = policyStore;
        this.properties = properties;
        this.clock = clock;
    }

    public RateDecision checkAndIncrement(String organizationId) {
        return checkAndIncrement(policyStore.getPolicy(organizationId));
    }

    /**
     * Count one request against both windows, burst first. A sustained-window denial
     * takes back the burst increment already made.
     */
    public RateDecision checkAndIncrement(Policy policy) {
        String org = policy.getOrganizationId();
        long now = clock.millis();

        Window burst = window(BURST, properties.getRate().getBurstWindow(), now);
        CounterResult burstResult = counters.addIfWithin(burst.key(org), 1, policy.getBurstRateLimit(), burst.ttl());
        if (!burstResult.applied()) {
            return denied(org, BURST, policy.getBurstRateLimit(), burst.retryAfterMs(now));
        }

        Window sustained = window(SUSTAINED, properties.getRate().getSustainedWindow(), now);
        CounterResult sustainedResult = counters.addIfWithin(sustained.key(org), 1,
                policy.getSustainedRateLimit(), sustained.ttl());
        if (!sustainedResult.applied()) {
            counters.add(burst.key(org), -1, burst.ttl());
            return denied(org, SUSTAINED, policy.getSustainedRateLimit(), sustained.retryAfterMs(now));
        }

        return RateDecision.allow();
    }

    /**
     * Like {@link #checkAndIncrement(Policy)} but throws on denial.
     *
     * @throws AdmissionDeniedException with reason RateLimited and a retry-after hint
     */
    public void enforce(Policy policy) {
        RateDecision decision = checkAndIncrement(policy);
        if (!decision.allowed()) {
            throw new AdmissionDeniedException(policy.getOrganizationId(), DenialReason.RATE_LIMITED,
                    String.format("Rate limit exceeded: %d requests per %s window",
                            decision.limit(), decision.window()),
                    decision.retryAfterMs());
        }
    }

    public RateLimitStatus status(Policy policy) {
        String org = policy.getOrganizationId();
        long now = clock.millis();
        Window burst = window(BURST, properties.getRate().getBurstWindow(), now);
        Window sustained = window(SUSTAINED, properties.getRate().getSustainedWindow(), now);

        return RateLimitStatus.builder()
                .organizationId(org)
                .burstCount((long) counters.get(burst.key(org)))
                .burstLimit(policy.getBurstRateLimit())
                .burstResetMs(burst.retryAfterMs(now))
                .sustainedCount((long) counters.get(sustained.key(org)))
                .sustainedLimit(policy.getSustainedRateLimit())
                .sustainedResetMs(sustained.retryAfterMs(now))
                .build();
    }

    /**
     * Clear the current windows of an organization.
     */
    public void reset(String organizationId) {
        long now = clock.millis();
        counters.delete(window(BURST, properties.getRate().getBurstWindow(), now).key(organizationId));
        counters.delete(window(SUSTAINED, properties.getRate().getSustainedWindow(), now).key(organizationId));
        log.info("Rate windows reset for org={}", organizationId);
    }

    private RateDecision denied(String org, String window, int limit, long retryAfterMs) {
        log.warn("Admission denied org={} reason={} window={} limit={} retryAfterMs={} at={}",
                org, DenialReason.RATE_LIMITED, window, limit, retryAfterMs, clock.instant());
        return RateDecision.deny(window, limit, retryAfterMs);
    }

    private static Window window(String type, Duration length, long now) {
        long millis = length.toMillis();
        return new Window(type, millis, now / millis);
    }

    private record Window(String type, long lengthMs, long index) {

        String key(String org) {
            return "rate:" + org + ":" + type + ":" + index;
        }

        long retryAfterMs(long now) {
            return (index + 1) * lengthMs - now;
        }

        Duration ttl() {
            return Duration.ofMillis(lengthMs * 2);
        }
    }
}
