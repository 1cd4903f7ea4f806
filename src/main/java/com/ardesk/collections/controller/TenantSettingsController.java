package com.ardesk.collections.controller;

import com.ardesk.collections.service.TenantSettingsService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/settings")
public class TenantSettingsController {

    private final TenantSettingsService tenantSettingsService;

    public TenantSettingsController(TenantSettingsService tenantSettingsService) {
        this.tenantSettingsService = tenantSettingsService;
    }

    @GetMapping
    public Map<String, String> settings(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId) {
        return tenantSettingsService.getSettings(TenantHeaders.require(tenantId));
    }

    // All four weights at once, so a tenant can move between valid sets in one write
    @PutMapping("/risk-weights")
    @PreAuthorize("hasRole('ADMIN')")
    public Map<String, String> updateRiskWeights(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @RequestBody Map<String, String> weights) {
        String tenant = TenantHeaders.require(tenantId);
        tenantSettingsService.updateRiskWeights(tenant, weights);
        return tenantSettingsService.getSettings(tenant);
    }

    @PutMapping("/{key}")
    @PreAuthorize("hasRole('ADMIN')")
    public Map<String, String> update(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @PathVariable String key, @RequestBody Map<String, String> body) {
        String tenant = TenantHeaders.require(tenantId);
        tenantSettingsService.updateSetting(tenant, key, body.get("value"));
        return tenantSettingsService.getSettings(tenant);
    }
}
