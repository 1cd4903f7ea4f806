package com.ardesk.collections.engine;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An invoice after receipts have been applied to it.
 */
@Value
public class InvoicePosition {
    Long invoiceId;
    String invoiceNumber;
    BigDecimal amount;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal paidAmount;
    LocalDate fullyPaidOn; // date of the receipt that closed it, null while open

    public boolean isPaidInFull() {
        return fullyPaidOn != null;
    }

    public boolean isUnpaid() {
        return paidAmount.compareTo(amount) < 0;
    }

    public BigDecimal getBalanceDue() {
        return amount.subtract(paidAmount);
    }
}
