package com.ardesk.collections.exception;

/**
 * A record loaded for one tenant references another tenant. Aborts the whole request.
 */
public class TenantIsolationException extends RuntimeException {

    private final String requestedTenantId;
    private final String foundTenantId;

    public TenantIsolationException(String requestedTenantId, String foundTenantId, String record) {
        super("Tenant isolation violation: " + record + " belongs to tenant '" + foundTenantId
                + "' but was read for tenant '" + requestedTenantId + "'");
        this.requestedTenantId = requestedTenantId;
        this.foundTenantId = foundTenantId;
    }

    public String getRequestedTenantId() {
        return requestedTenantId;
    }

    public String getFoundTenantId() {
        return foundTenantId;
    }
}
