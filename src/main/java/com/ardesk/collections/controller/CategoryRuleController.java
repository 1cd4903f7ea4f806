package com.ardesk.collections.controller;

import com.ardesk.collections.dto.RecalculationSummary;
import com.ardesk.collections.model.CategoryRule;
import com.ardesk.collections.service.CategoryRecalculationService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/category-rules")
public class CategoryRuleController {

    private final CategoryRecalculationService categoryRecalculationService;

    public CategoryRuleController(CategoryRecalculationService categoryRecalculationService) {
        this.categoryRecalculationService = categoryRecalculationService;
    }

    @GetMapping
    public List<CategoryRule> list(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId) {
        return categoryRecalculationService.rules(TenantHeaders.require(tenantId));
    }

    @PostMapping("/recalculate")
    @PreAuthorize("hasRole('ADMIN')")
    public RecalculationSummary recalculate(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @RequestParam(defaultValue = "0") int fromPage) {
        return categoryRecalculationService.recalculate(TenantHeaders.require(tenantId), fromPage);
    }
}
