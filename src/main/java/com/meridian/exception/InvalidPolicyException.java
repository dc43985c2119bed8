package com.meridian.exception;

import java.util.List;

/**
 * Policy rejected on write. Carries every violated field, not just the first.
 */
public class InvalidPolicyException extends RoutingException {

    private final List<String> violations;

    public InvalidPolicyException(String organizationId, List<String> violations) {
        super("Invalid policy for " + organizationId + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
