package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-category constraints set by an organization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOverride {

    /**
     * Minimum quality in [0,1].
     */
    private Double minPerf;

    /**
     * Model names in preference order.
     */
    @Builder.Default
    private List<String> preferredModels = new ArrayList<>();

    private Double maxCost;
}
