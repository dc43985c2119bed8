package com.meridian.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache for policy reads. Policies are read on every request and written rarely.
 */
@Configuration
public class CacheConfiguration {

    public static final String POLICY_CACHE = "policies";

    private final MeridianProperties properties;

    public CacheConfiguration(MeridianProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(POLICY_CACHE);
        cacheManager.setCaffeine(caffeineCacheBuilder());
        return cacheManager;
    }

    private Caffeine<Object, Object> caffeineCacheBuilder() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getPolicy().getCacheMaxSize())
                .expireAfterWrite(properties.getPolicy().getCacheTtl())
                .recordStats();
    }
}
