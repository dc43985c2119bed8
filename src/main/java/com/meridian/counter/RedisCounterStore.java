package com.meridian.counter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed counters shared by every node.
 *
 * <p>Conditional increments use increment-then-verify: {@code INCRBYFLOAT} first, and if the
 * result overshoots the ceiling the same delta is subtracted again. A concurrent reader may
 * briefly observe the overshoot and be denied, but no two writers can both keep an increment
 * that jointly passes the ceiling.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCounterStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public CounterResult addIfWithin(String key, double delta, double ceiling, Duration ttl) {
        String redisKey = buildKey(key);
        Double updated = redisTemplate.opsForValue().increment(redisKey, delta);
        double value = updated != null ? updated : delta;

        if (value > ceiling + CounterResult.EPSILON) {
            Double rolledBack = redisTemplate.opsForValue().increment(redisKey, -delta);
            // a rejected first write leaves a zero-valued key behind
            redisTemplate.expire(redisKey, ttl);
            log.debug("Counter {} rejected delta={} ceiling={}", redisKey, delta, ceiling);
            return CounterResult.rejected(rolledBack != null ? rolledBack : value - delta);
        }

        redisTemplate.expire(redisKey, ttl);
        return CounterResult.applied(value);
    }

    @Override
    public double add(String key, double delta, Duration ttl) {
        String redisKey = buildKey(key);
        Double updated = redisTemplate.opsForValue().increment(redisKey, delta);
        redisTemplate.expire(redisKey, ttl);
        return updated != null ? updated : delta;
    }

    @Override
    public double get(String key) {
        String raw = redisTemplate.opsForValue().get(buildKey(key));
        if (raw == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.error("Non-numeric counter value at {}: {}", buildKey(key), raw);
            throw new IllegalStateException("Corrupt counter " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(buildKey(key));
    }

    private String buildKey(String key) {
        return keyPrefix + key;
    }
}
