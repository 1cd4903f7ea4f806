package com.ardesk.collections.controller;

import com.ardesk.collections.dto.StatusCard;
import com.ardesk.collections.service.InvoiceStatusService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/invoices")
public class InvoiceStatusController {

    private final InvoiceStatusService invoiceStatusService;

    public InvoiceStatusController(InvoiceStatusService invoiceStatusService) {
        this.invoiceStatusService = invoiceStatusService;
    }

    @GetMapping("/status-cards")
    public Map<String, StatusCard> statusCards(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId) {
        return invoiceStatusService.statusCards(TenantHeaders.require(tenantId));
    }
}
