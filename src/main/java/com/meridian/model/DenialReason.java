package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why admission refused a request. All of these are recoverable by retrying later.
 */
public enum DenialReason {
    DAILY_BUDGET_EXCEEDED("DailyBudgetExceeded"),
    REQUEST_COST_EXCEEDS_LIMIT("RequestCostExceedsLimit"),
    CONCURRENCY_LIMIT_EXCEEDED("ConcurrencyLimitExceeded"),
    RATE_LIMITED("RateLimited"),
    TOKEN_LIMIT_EXCEEDED("TokenLimitExceeded");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
