package com.ardesk.collections.engine;

import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.FollowUp;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Builds one customer's {@link DebtorSnapshot} from their ledger rows.
 */
@Component
public class DebtorCalculator {

    private final LedgerAggregator ledgerAggregator;
    private final PaymentAllocator paymentAllocator;
    private final CategoryClassifier categoryClassifier;
    private final FollowUpBucketEngine followUpBucketEngine;

    public DebtorCalculator(LedgerAggregator ledgerAggregator, PaymentAllocator paymentAllocator,
            CategoryClassifier categoryClassifier, FollowUpBucketEngine followUpBucketEngine) {
        this.ledgerAggregator = ledgerAggregator;
        this.paymentAllocator = paymentAllocator;
        this.categoryClassifier = categoryClassifier;
        this.followUpBucketEngine = followUpBucketEngine;
    }

    public DebtorSnapshot snapshot(CustomerLedger ledger, LocalDateTime now) {
        Customer customer = ledger.getCustomer();
        LedgerTotals totals = ledgerAggregator.aggregate(customer, ledger.getInvoices(), ledger.getReceipts());
        List<InvoicePosition> positions = paymentAllocator.allocate(customer, ledger.getInvoices(),
                ledger.getReceipts());

        FollowUp latest = followUpBucketEngine.latest(ledger.getFollowUps());
        LocalDateTime next = latest == null ? null : latest.getNextFollowUpDate();

        return DebtorSnapshot.builder()
                .customerId(customer.getId())
                .customerName(customer.getName())
                .category(customer.getCategory())
                .salesPerson(customer.getSalesPerson())
                .openingBalance(totals.getOpeningBalance())
                .invoiceTotal(totals.getInvoiceTotal())
                .receiptTotal(totals.getReceiptTotal())
                .outstandingBalance(totals.getOutstandingBalance())
                .invoiceCount(totals.getInvoiceCount())
                .receiptCount(totals.getReceiptCount())
                .lastInvoiceDate(totals.getLastInvoiceDate())
                .lastPaymentDate(totals.getLastPaymentDate())
                .overdueDays(categoryClassifier.overdueDays(positions, now.toLocalDate()))
                .lastFollowUpDate(latest == null ? null : latest.getFollowUpDateTime())
                .nextFollowUpDate(next)
                .followUpBucket(followUpBucketEngine.classify(next, now))
                .build();
    }
}
