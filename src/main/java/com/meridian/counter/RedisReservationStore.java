package com.meridian.counter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meridian.model.Reservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reservations in Redis.
 *
 * <p>Key pattern: {prefix}reservation:{id} holds the JSON record with a TTL; the sorted set
 * {prefix}reservations indexes open ids by creation time for the stale sweep. Removal uses
 * {@code GETDEL}, so exactly one node settles each reservation.
 */
@Slf4j
public class RedisReservationStore implements ReservationStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisReservationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void save(Reservation reservation, Duration ttl) {
        redisTemplate.opsForValue().set(recordKey(reservation.getId()), serialize(reservation), ttl);
        redisTemplate.opsForZSet().add(indexKey(), reservation.getId(), reservation.getCreatedAt().toEpochMilli());
    }

    @Override
    public boolean replace(Reservation reservation, Duration ttl) {
        Boolean replaced = redisTemplate.opsForValue()
                .setIfPresent(recordKey(reservation.getId()), serialize(reservation), ttl);
        return Boolean.TRUE.equals(replaced);
    }

    @Override
    public Optional<Reservation> find(String reservationId) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(recordKey(reservationId)))
                .map(this::deserialize);
    }

    @Override
    public Optional<Reservation> remove(String reservationId) {
        String json = redisTemplate.opsForValue().getAndDelete(recordKey(reservationId));
        redisTemplate.opsForZSet().remove(indexKey(), reservationId);
        return Optional.ofNullable(json).map(this::deserialize);
    }

    @Override
    public List<Reservation> createdBefore(Instant cutoff) {
        Set<String> ids = redisTemplate.opsForZSet()
                .rangeByScore(indexKey(), Double.NEGATIVE_INFINITY, cutoff.toEpochMilli() - 1);
        List<Reservation> result = new ArrayList<>();
        if (ids == null) {
            return result;
        }
        for (String id : ids) {
            Optional<Reservation> reservation = find(id);
            if (reservation.isPresent()) {
                result.add(reservation.get());
            } else {
                log.warn("Reservation {} expired before it was settled; dropping it from the index", id);
                redisTemplate.opsForZSet().remove(indexKey(), id);
            }
        }
        return result;
    }

    private String serialize(Reservation reservation) {
        try {
            return objectMapper.writeValueAsString(reservation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize reservation " + reservation.getId(), e);
        }
    }

    private Reservation deserialize(String json) {
        try {
            return objectMapper.readValue(json, Reservation.class);
        } catch (JsonProcessingException e) {
            log.error("Corrupt reservation record: {}", json);
            throw new IllegalStateException("Corrupt reservation record", e);
        }
    }

    private String recordKey(String reservationId) {
        return keyPrefix + "reservation:" + reservationId;
    }

    private String indexKey() {
        return keyPrefix + "reservations";
    }
}
