package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionFactor {
    COST,
    LATENCY,
    ERROR,
    QUALITY;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
