package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Optional criteria for decision history queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionFilter {

    private Instant from;

    private Instant to;

    private TaskCategory taskCategory;

    private String provider;

    @Builder.Default
    private int limit = 100;
}
