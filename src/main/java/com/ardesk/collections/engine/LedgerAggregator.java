package com.ardesk.collections.engine;

import com.ardesk.collections.exception.LedgerDataException;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import com.ardesk.collections.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Reduces a customer's opening balance, invoices and receipts to reconciled totals.
 */
@Component
public class LedgerAggregator {

    /**
     * @throws LedgerDataException when an amount or date of this customer's rows is unusable
     */
    public LedgerTotals aggregate(Customer customer, List<Invoice> invoices, List<Receipt> receipts) {
        Long customerId = customer.getId();
        BigDecimal openingBalance = Money.orZero(customer.getOpeningBalance(), customerId, "openingBalance");

        BigDecimal invoiceTotal = Money.ZERO;
        LocalDate lastInvoiceDate = null;
        for (Invoice invoice : invoices) {
            invoiceTotal = invoiceTotal.add(Money.require(invoice.getAmount(), customerId, "invoice.amount"));
            LocalDate date = requireDate(invoice.getInvoiceDate(), customerId, "invoice.invoiceDate");
            if (lastInvoiceDate == null || date.isAfter(lastInvoiceDate)) {
                lastInvoiceDate = date;
            }
        }

        BigDecimal receiptTotal = Money.ZERO;
        LocalDate lastPaymentDate = null;
        for (Receipt receipt : receipts) {
            receiptTotal = receiptTotal.add(Money.require(receipt.getAmount(), customerId, "receipt.amount"));
            LocalDate date = requireDate(receipt.getReceiptDate(), customerId, "receipt.receiptDate");
            if (lastPaymentDate == null || date.isAfter(lastPaymentDate)) {
                lastPaymentDate = date;
            }
        }

        return LedgerTotals.builder()
                .customerId(customerId)
                .openingBalance(openingBalance)
                .invoiceTotal(invoiceTotal)
                .receiptTotal(receiptTotal)
                .outstandingBalance(openingBalance.add(invoiceTotal).subtract(receiptTotal))
                .invoiceCount(invoices.size())
                .receiptCount(receipts.size())
                .lastInvoiceDate(lastInvoiceDate)
                .lastPaymentDate(lastPaymentDate)
                .build();
    }

    static LocalDate requireDate(LocalDate date, Long customerId, String field) {
        if (date == null) {
            throw new LedgerDataException(customerId, field, "date is missing");
        }
        return date;
    }
}
