package com.ardesk.collections.controller;

import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.service.TenantSummaryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class TenantControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TenantSummaryService tenantSummaryService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void summary_ShouldReturnAggregates_ForAdmin() throws Exception {
        when(tenantSummaryService.summary("acme")).thenReturn(TenantSummary.builder()
                .tenantId("acme")
                .openingBalance(new BigDecimal("100.00"))
                .invoiceTotal(new BigDecimal("400.00"))
                .receiptTotal(new BigDecimal("150.00"))
                .outstandingBalance(new BigDecimal("350.00"))
                .customerCount(2)
                .invoiceCount(4)
                .receiptCount(1)
                .categoryBreakdown(List.of(new TenantSummary.CategoryCount("Alpha", 2)))
                .receiptBreakdown(List.of())
                .avgInvoiceValue(new BigDecimal("100.00"))
                .avgReceiptValue(new BigDecimal("150.00"))
                .build());

        mockMvc.perform(get("/tenants/acme/summary").header("X-Tenant-Id", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.invoiceCount").value(4))
                .andExpect(jsonPath("$.categoryBreakdown[0].category").value("Alpha"));
    }

    @Test
    @WithMockUser(roles = "USER")
    void summary_ShouldBeForbidden_ForNonAdmin() throws Exception {
        mockMvc.perform(get("/tenants/acme/summary").header("X-Tenant-Id", "acme"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(tenantSummaryService);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void summary_ShouldBeForbidden_ForAnotherTenant() throws Exception {
        mockMvc.perform(get("/tenants/globex/summary").header("X-Tenant-Id", "acme"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(tenantSummaryService);
    }
}
