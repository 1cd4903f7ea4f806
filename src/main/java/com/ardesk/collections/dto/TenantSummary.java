package com.ardesk.collections.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class TenantSummary {
    String tenantId;
    BigDecimal openingBalance;
    BigDecimal invoiceTotal;
    BigDecimal receiptTotal;
    BigDecimal outstandingBalance;
    long customerCount;
    long skippedCustomerCount;
    long invoiceCount;
    long receiptCount;
    List<CategoryCount> categoryBreakdown;
    List<ReceiptTypeTotal> receiptBreakdown;
    BigDecimal avgInvoiceValue;
    BigDecimal avgReceiptValue;

    @Value
    public static class CategoryCount {
        String category;
        long count;
    }

    @Value
    public static class ReceiptTypeTotal {
        String type;
        long count;
        BigDecimal total;
    }
}
