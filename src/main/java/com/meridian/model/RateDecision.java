package com.meridian.model;

/**
 * Rate limiter verdict.
 *
 * @param allowed      whether the request was counted
 * @param window       window that denied the request ("burst" or "sustained"), null when allowed
 * @param limit        limit of the denying window
 * @param retryAfterMs time until the denying window rolls over
 */
public record RateDecision(boolean allowed, String window, int limit, long retryAfterMs) {

    public static RateDecision allow() {
        return new RateDecision(true, null, 0, 0L);
    }

    public static RateDecision deny(String window, int limit, long retryAfterMs) {
        return new RateDecision(false, window, limit, retryAfterMs);
    }
}
