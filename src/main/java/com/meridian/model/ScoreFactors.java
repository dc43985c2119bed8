package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized sub-scores of the selected candidate, each in [0,1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreFactors {

    private double costScore;

    private double latencyScore;

    private double errorScore;

    private double qualityScore;

    private double totalScore;

    public static ScoreFactors zero() {
        return new ScoreFactors(0, 0, 0, 0, 0);
    }
}
