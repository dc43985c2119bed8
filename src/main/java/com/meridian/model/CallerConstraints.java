package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Constraints supplied with a single request. They can only narrow the policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerConstraints {

    private Double maxCost;

    private Double minPerf;

    private boolean forceCheapest;
}
