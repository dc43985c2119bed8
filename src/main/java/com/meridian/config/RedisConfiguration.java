package com.meridian.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meridian.counter.CounterStore;
import com.meridian.counter.RedisCounterStore;
import com.meridian.counter.RedisReservationStore;
import com.meridian.counter.ReservationStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis configuration for shared guardrail counters and open reservations.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "meridian.counters", name = "backend", havingValue = "redis")
public class RedisConfiguration {

    /**
     * Lettuce connection factory with short command timeouts; admission must fail fast.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties) {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(5))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(Duration.ofSeconds(2)))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofSeconds(2))
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        if (redisProperties.getPassword() != null) {
            server.setPassword(redisProperties.getPassword());
        }

        log.info("Configured Redis counter connection to {}:{}", redisProperties.getHost(), redisProperties.getPort());
        return new LettuceConnectionFactory(server, clientConfig);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public CounterStore redisCounterStore(StringRedisTemplate stringRedisTemplate, MeridianProperties properties) {
        log.info("Using Redis counter store with prefix '{}'", properties.getCounters().getKeyPrefix());
        return new RedisCounterStore(stringRedisTemplate, properties.getCounters().getKeyPrefix());
    }

    @Bean
    public ReservationStore redisReservationStore(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper,
                                                  MeridianProperties properties) {
        return new RedisReservationStore(stringRedisTemplate, objectMapper, properties.getCounters().getKeyPrefix());
    }
}
