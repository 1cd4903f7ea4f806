package com.ardesk.collections.engine;

import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.model.CustomerCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Tenant-wide sums and counts computed by the database.
 */
@Value
@Builder
public class LedgerAggregates {
    BigDecimal openingBalance;
    BigDecimal invoiceTotal;
    long invoiceCount;
    BigDecimal receiptTotal;
    long receiptCount;
    long skippedCustomerCount; // customers with rows that fail validation, left out of every figure
    Map<CustomerCategory, Long> customersByCategory;
    List<TenantSummary.ReceiptTypeTotal> receiptBreakdown;
}
