package com.ardesk.collections.service;

import com.ardesk.collections.dto.StatusCard;
import com.ardesk.collections.engine.InvoicePosition;
import com.ardesk.collections.engine.PaymentAllocator;
import com.ardesk.collections.util.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Payment-status cards over every invoice of a tenant. An invoice is only overdue once its grace
 * period has passed.
 */
@Service
public class InvoiceStatusService {

    public static final String UPCOMING = "upcoming";
    public static final String DUE_TODAY = "dueToday";
    public static final String IN_GRACE = "inGrace";
    public static final String OVERDUE = "overdue";
    public static final String PAID_ON_TIME = "paidOnTime";
    public static final String PAID_LATE = "paidLate";

    private static final List<String> CARDS = List.of(UPCOMING, DUE_TODAY, IN_GRACE, OVERDUE, PAID_ON_TIME,
            PAID_LATE);

    private final LedgerSnapshotService ledgerSnapshotService;
    private final CustomerComputationRunner runner;
    private final PaymentAllocator paymentAllocator;
    private final TenantSettingsService tenantSettingsService;
    private final Clock clock;

    public InvoiceStatusService(LedgerSnapshotService ledgerSnapshotService,
            CustomerComputationRunner runner,
            PaymentAllocator paymentAllocator,
            TenantSettingsService tenantSettingsService,
            Clock clock) {
        this.ledgerSnapshotService = ledgerSnapshotService;
        this.runner = runner;
        this.paymentAllocator = paymentAllocator;
        this.tenantSettingsService = tenantSettingsService;
        this.clock = clock;
    }

    public Map<String, StatusCard> statusCards(String tenantId) {
        int graceDays = tenantSettingsService.getGraceDays(tenantId);
        LocalDate today = LocalDate.now(clock);
        TenantLedger ledger = ledgerSnapshotService.load(tenantId);

        List<List<InvoicePosition>> perCustomer = runner.run(ledger, customerLedger -> Optional.of(
                paymentAllocator.allocate(customerLedger.getCustomer(), customerLedger.getInvoices(),
                        customerLedger.getReceipts())))
                .getResults();

        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        for (String card : CARDS) {
            counts.put(card, new long[1]);
            amounts.put(card, Money.ZERO);
        }
        for (List<InvoicePosition> positions : perCustomer) {
            for (InvoicePosition position : positions) {
                String card = classify(position, today, graceDays);
                counts.get(card)[0]++;
                amounts.merge(card, position.getAmount(), BigDecimal::add);
            }
        }

        Map<String, StatusCard> cards = new LinkedHashMap<>();
        for (String card : CARDS) {
            cards.put(card, new StatusCard(counts.get(card)[0], amounts.get(card)));
        }
        return cards;
    }

    static String classify(InvoicePosition position, LocalDate today, int graceDays) {
        LocalDate graceEnd = position.getDueDate().plusDays(graceDays);
        if (position.isPaidInFull()) {
            return position.getFullyPaidOn().isAfter(graceEnd) ? PAID_LATE : PAID_ON_TIME;
        }
        if (position.getDueDate().isAfter(today)) {
            return UPCOMING;
        }
        if (position.getDueDate().isEqual(today)) {
            return DUE_TODAY;
        }
        return today.isAfter(graceEnd) ? OVERDUE : IN_GRACE;
    }
}
