package com.meridian.exception;

public class PolicyNotFoundException extends RoutingException {

    private final String organizationId;

    public PolicyNotFoundException(String organizationId) {
        super("No policy configured for organization " + organizationId);
        this.organizationId = organizationId;
    }

    public String getOrganizationId() {
        return organizationId;
    }
}
