package com.ardesk.collections.engine;

import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import com.ardesk.collections.util.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives paid amounts by replaying a customer's receipts against their invoices.
 * <p>
 * Receipts are applied in date order. A receipt linked to an invoice pays that invoice first; the
 * remainder, and every unlinked receipt, pays the oldest open invoice first. Money left over once all
 * invoices are settled stays unapplied.
 */
@Slf4j
@Component
public class PaymentAllocator {

    private static final Comparator<Invoice> OLDEST_FIRST = Comparator
            .comparing(Invoice::getInvoiceDate)
            .thenComparing(Invoice::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Receipt> CHRONOLOGICAL = Comparator
            .comparing(Receipt::getReceiptDate)
            .thenComparing(Receipt::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<InvoicePosition> allocate(Customer customer, List<Invoice> invoices, List<Receipt> receipts) {
        Long customerId = customer.getId();
        int defaultTerms = customer.getPaymentTermsDays();

        List<Invoice> ordered = new ArrayList<>(invoices);
        for (Invoice invoice : ordered) {
            Money.require(invoice.getAmount(), customerId, "invoice.amount");
            LedgerAggregator.requireDate(invoice.getInvoiceDate(), customerId, "invoice.invoiceDate");
        }
        ordered.sort(OLDEST_FIRST);

        List<Receipt> payments = new ArrayList<>(receipts);
        for (Receipt receipt : payments) {
            Money.require(receipt.getAmount(), customerId, "receipt.amount");
            LedgerAggregator.requireDate(receipt.getReceiptDate(), customerId, "receipt.receiptDate");
        }
        payments.sort(CHRONOLOGICAL);

        Map<Invoice, BigDecimal> paid = new IdentityHashMap<>();
        Map<Invoice, LocalDate> closedOn = new IdentityHashMap<>();
        Map<Long, Invoice> byId = new HashMap<>();
        for (Invoice invoice : ordered) {
            paid.put(invoice, Money.ZERO);
            if (invoice.getId() != null) {
                byId.put(invoice.getId(), invoice);
            }
            if (invoice.getAmount().signum() == 0) {
                closedOn.put(invoice, invoice.getInvoiceDate());
            }
        }

        for (Receipt receipt : payments) {
            BigDecimal remaining = Money.require(receipt.getAmount(), customerId, "receipt.amount");

            if (receipt.getLinkedInvoiceId() != null) {
                Invoice linked = byId.get(receipt.getLinkedInvoiceId());
                if (linked != null) {
                    remaining = apply(linked, remaining, receipt.getReceiptDate(), paid, closedOn);
                } else {
                    log.debug("Receipt {} links invoice {} outside customer {}; applying oldest first",
                            receipt.getId(), receipt.getLinkedInvoiceId(), customerId);
                }
            }

            for (Invoice invoice : ordered) {
                if (remaining.signum() <= 0)
                    break;
                remaining = apply(invoice, remaining, receipt.getReceiptDate(), paid, closedOn);
            }
        }

        List<InvoicePosition> positions = new ArrayList<>(ordered.size());
        for (Invoice invoice : ordered) {
            int terms = invoice.getPaymentTermsDays() != null ? invoice.getPaymentTermsDays() : defaultTerms;
            positions.add(new InvoicePosition(
                    invoice.getId(),
                    invoice.getInvoiceNumber(),
                    Money.require(invoice.getAmount(), customerId, "invoice.amount"),
                    invoice.getInvoiceDate(),
                    invoice.getInvoiceDate().plusDays(terms),
                    paid.get(invoice),
                    closedOn.get(invoice)));
        }
        return positions;
    }

    // Returns what is left of the receipt after paying as much of this invoice as possible
    private BigDecimal apply(Invoice invoice, BigDecimal available, LocalDate receiptDate,
            Map<Invoice, BigDecimal> paid, Map<Invoice, LocalDate> closedOn) {
        BigDecimal alreadyPaid = paid.get(invoice);
        BigDecimal due = invoice.getAmount().subtract(alreadyPaid);
        if (due.signum() <= 0) {
            return available;
        }

        BigDecimal allocation = due.min(available);
        paid.put(invoice, Money.normalize(alreadyPaid.add(allocation)));
        if (allocation.compareTo(due) == 0) {
            closedOn.put(invoice, receiptDate);
        }
        return available.subtract(allocation);
    }
}
