package com.ardesk.collections.service;

import com.ardesk.collections.dto.BucketStat;
import com.ardesk.collections.dto.CreditUtilization;
import com.ardesk.collections.dto.DebtorFilter;
import com.ardesk.collections.dto.DebtorReport;
import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.engine.AggregationReporter;
import com.ardesk.collections.engine.DebtorCalculator;
import com.ardesk.collections.engine.LedgerAggregator;
import com.ardesk.collections.engine.LedgerTotals;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.util.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class DebtorService {

    private static final Comparator<DebtorSnapshot> LARGEST_BALANCE_FIRST = Comparator
            .comparing(DebtorSnapshot::getOutstandingBalance, Comparator.reverseOrder())
            .thenComparing(DebtorSnapshot::getCustomerName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(DebtorSnapshot::getCustomerId);

    private static final Comparator<CreditUtilization> MOST_UTILIZED_FIRST = Comparator
            .comparing(CreditUtilization::getUtilizationPercentage, Comparator.reverseOrder())
            .thenComparing(CreditUtilization::getCustomerName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(CreditUtilization::getCustomerId);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerSnapshotService ledgerSnapshotService;
    private final CustomerComputationRunner runner;
    private final DebtorCalculator debtorCalculator;
    private final LedgerAggregator ledgerAggregator;
    private final AggregationReporter aggregationReporter;
    private final Clock clock;

    public DebtorService(LedgerSnapshotService ledgerSnapshotService,
            CustomerComputationRunner runner,
            DebtorCalculator debtorCalculator,
            LedgerAggregator ledgerAggregator,
            AggregationReporter aggregationReporter,
            Clock clock) {
        this.ledgerSnapshotService = ledgerSnapshotService;
        this.runner = runner;
        this.debtorCalculator = debtorCalculator;
        this.ledgerAggregator = ledgerAggregator;
        this.aggregationReporter = aggregationReporter;
        this.clock = clock;
    }

    /**
     * Debtor rows matching the filter plus a category roll-up over exactly those rows.
     */
    public DebtorReport listDebtors(String tenantId, DebtorFilter filter) {
        ComputationResult<DebtorSnapshot> computed = computeSnapshots(tenantId);
        List<DebtorSnapshot> visible = computed.getResults().stream()
                .filter(filter::matches)
                .sorted(LARGEST_BALANCE_FIRST)
                .toList();
        log.debug("Tenant {}: {} of {} debtors match {}", tenantId, visible.size(), computed.getResults().size(),
                filter);
        return new DebtorReport(visible, aggregationReporter.categoryRollup(visible), computed.getSkipped());
    }

    public Map<String, BucketStat> followUpStats(String tenantId, DebtorFilter filter) {
        List<DebtorSnapshot> visible = computeSnapshots(tenantId).getResults().stream()
                .filter(filter::matches)
                .toList();
        return aggregationReporter.followUpStats(visible);
    }

    public List<CreditUtilization> creditUtilization(String tenantId) {
        TenantLedger ledger = ledgerSnapshotService.load(tenantId);
        return runner.run(ledger, customerLedger -> {
            Customer customer = customerLedger.getCustomer();
            LedgerTotals totals = ledgerAggregator.aggregate(customer, customerLedger.getInvoices(),
                    customerLedger.getReceipts());
            BigDecimal limit = Money.orZero(customer.getCreditLimit(), customer.getId(), "creditLimit");
            BigDecimal utilized = totals.getInvoiceTotal().subtract(totals.getReceiptTotal());
            BigDecimal percentage = limit.signum() > 0
                    ? utilized.multiply(HUNDRED).divide(limit, Money.SCALE, RoundingMode.HALF_UP)
                    : Money.ZERO;
            return Optional.of(new CreditUtilization(customer.getId(), customer.getName(), customer.getCategory(),
                    limit, utilized, limit.subtract(utilized), percentage));
        }).getResults().stream().sorted(MOST_UTILIZED_FIRST).toList();
    }

    private ComputationResult<DebtorSnapshot> computeSnapshots(String tenantId) {
        TenantLedger ledger = ledgerSnapshotService.load(tenantId);
        LocalDateTime now = LocalDateTime.now(clock);
        return runner.run(ledger, customerLedger -> Optional.of(debtorCalculator.snapshot(customerLedger, now)));
    }
}
