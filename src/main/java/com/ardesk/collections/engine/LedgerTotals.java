package com.ardesk.collections.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class LedgerTotals {
    Long customerId;
    BigDecimal openingBalance;
    BigDecimal invoiceTotal;
    BigDecimal receiptTotal;
    BigDecimal outstandingBalance;
    int invoiceCount;
    int receiptCount;
    LocalDate lastInvoiceDate;
    LocalDate lastPaymentDate;
}
