package com.meridian.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the response_cache_entries table.
 * Only hit_count and last_accessed_at change after insert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "response_cache_entries", indexes = {
        @Index(name = "idx_cache_key", columnList = "cache_key", unique = true),
        @Index(name = "idx_cache_expires", columnList = "expires_at"),
        @Index(name = "idx_cache_last_accessed", columnList = "last_accessed_at")
})
public class CacheEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "cache_key", nullable = false, unique = true, length = 64)
    private String cacheKey;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Column(name = "completion", nullable = false, columnDefinition = "TEXT")
    private String completion;

    @Column(name = "tokens_in")
    private Integer tokensIn;

    @Column(name = "tokens_out")
    private Integer tokensOut;

    /**
     * Cost of producing the completion, i.e. what a hit avoids paying.
     */
    @Column(name = "estimated_cost")
    private Double estimatedCost;

    @Builder.Default
    @Column(name = "hit_count", nullable = false)
    private Integer hitCount = 0;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (lastAccessedAt == null) {
            lastAccessedAt = createdAt;
        }
        if (hitCount == null) {
            hitCount = 0;
        }
    }

    /**
     * Check if this entry is expired at the given time.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
