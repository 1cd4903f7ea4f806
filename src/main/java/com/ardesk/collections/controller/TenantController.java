package com.ardesk.collections.controller;

import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.service.TenantSummaryService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tenants")
public class TenantController {

    private final TenantSummaryService tenantSummaryService;

    public TenantController(TenantSummaryService tenantSummaryService) {
        this.tenantSummaryService = tenantSummaryService;
    }

    // An admin only sees the tenant named in their own header
    @GetMapping("/{tenantId}/summary")
    @PreAuthorize("hasRole('ADMIN')")
    public TenantSummary summary(@PathVariable String tenantId,
            @RequestHeader(TenantHeaders.TENANT_HEADER) String headerTenantId) {
        String tenant = TenantHeaders.require(headerTenantId);
        if (!tenant.equals(tenantId)) {
            throw new AccessDeniedException("Tenant " + tenantId + " is not the caller's tenant");
        }
        return tenantSummaryService.summary(tenant);
    }
}
