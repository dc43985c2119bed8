package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a candidate model was left out of selection.
 */
public enum RejectReason {
    PROVIDER_NOT_ALLOWED("ProviderNotAllowed"),
    CIRCUIT_OPEN("CircuitOpen"),
    BELOW_MIN_PERFORMANCE("BelowMinPerformance"),
    EXCEEDS_MAX_COST("ExceedsMaxCost");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RejectReason fromCode(String code) {
        for (RejectReason reason : values()) {
            if (reason.code.equals(code) || reason.name().equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown reject reason: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
