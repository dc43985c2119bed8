package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A candidate that was considered for a decision, selected or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alternative {

    private String provider;

    private String model;

    private double score;

    private double estimatedCost;

    private boolean rejected;

    private RejectReason rejectReason;

    public String key() {
        return provider + ":" + model;
    }
}
