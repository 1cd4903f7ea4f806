package com.ardesk.collections.dto;

import com.ardesk.collections.engine.FollowUpBucket;
import com.ardesk.collections.model.CustomerCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reconciled view of one customer's ledger at query time. Never stored.
 * {@code outstandingBalance == openingBalance + invoiceTotal - receiptTotal}.
 */
@Value
@Builder
public class DebtorSnapshot {
    Long customerId;
    String customerName;
    CustomerCategory category;
    String salesPerson;

    BigDecimal openingBalance;
    BigDecimal invoiceTotal;
    BigDecimal receiptTotal;
    BigDecimal outstandingBalance;
    int invoiceCount;
    int receiptCount;
    LocalDate lastInvoiceDate;
    LocalDate lastPaymentDate;

    long overdueDays;
    LocalDateTime lastFollowUpDate;
    LocalDateTime nextFollowUpDate;
    FollowUpBucket followUpBucket;
}
