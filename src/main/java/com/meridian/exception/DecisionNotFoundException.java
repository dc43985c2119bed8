package com.meridian.exception;

public class DecisionNotFoundException extends RoutingException {

    public DecisionNotFoundException(String decisionId) {
        super("Decision not found: " + decisionId);
    }
}
