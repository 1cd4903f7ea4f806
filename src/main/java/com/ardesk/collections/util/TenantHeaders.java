package com.ardesk.collections.util;

public final class TenantHeaders {

    public static final String TENANT_HEADER = "X-Tenant-Id";

    private TenantHeaders() {
    }

    public static String require(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException(TENANT_HEADER + " header must not be blank");
        }
        return tenantId.trim();
    }
}
