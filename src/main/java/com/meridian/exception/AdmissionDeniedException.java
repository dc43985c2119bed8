package com.meridian.exception;

import com.meridian.model.DenialReason;

/**
 * Request refused by a guardrail. The caller may retry later.
 */
public class AdmissionDeniedException extends RoutingException {

    private final String organizationId;
    private final DenialReason reason;
    private final Long retryAfterMs;

    public AdmissionDeniedException(String organizationId, DenialReason reason, String message) {
        this(organizationId, reason, message, null);
    }

    public AdmissionDeniedException(String organizationId, DenialReason reason, String message, Long retryAfterMs) {
        super(message);
        this.organizationId = organizationId;
        this.reason = reason;
        this.retryAfterMs = retryAfterMs;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public DenialReason getReason() {
        return reason;
    }

    /**
     * Milliseconds until a retry can succeed, null when unknown.
     */
    public Long getRetryAfterMs() {
        return retryAfterMs;
    }
}
