package com.meridian.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the telemetry_samples table (append-only).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "telemetry_samples", indexes = {
        @Index(name = "idx_sample_model_time", columnList = "provider, model, recorded_at"),
        @Index(name = "idx_sample_time", columnList = "recorded_at")
})
public class TelemetrySampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "latency_ms", nullable = false)
    private double latencyMs;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "cost_usd", nullable = false)
    private double costUsd;
}
