package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CostEfficiency {
    OPTIMAL,
    GOOD,
    POOR;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
