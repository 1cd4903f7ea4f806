package com.ardesk.collections.service;

import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.engine.AggregationReporter;
import com.ardesk.collections.engine.LedgerAggregates;
import com.ardesk.collections.exception.DependencyUnavailableException;
import com.ardesk.collections.model.CustomerCategory;
import com.ardesk.collections.repository.CustomerRepository;
import com.ardesk.collections.repository.InvoiceRepository;
import com.ardesk.collections.repository.ReceiptRepository;
import com.ardesk.collections.util.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tenant totals straight from aggregate queries; no per-row loading. Customers the engine would skip
 * for bad amounts or dates are excluded from every figure and only counted.
 */
@Slf4j
@Service
public class TenantSummaryService {

    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final ReceiptRepository receiptRepository;
    private final AggregationReporter aggregationReporter;

    public TenantSummaryService(CustomerRepository customerRepository,
            InvoiceRepository invoiceRepository,
            ReceiptRepository receiptRepository,
            AggregationReporter aggregationReporter) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.receiptRepository = receiptRepository;
        this.aggregationReporter = aggregationReporter;
    }

    @Transactional(readOnly = true)
    public TenantSummary summary(String tenantId) {
        try {
            Object[] invoiceTotals = single(invoiceRepository.totalsByTenant(tenantId));
            Object[] receiptTotals = single(receiptRepository.totalsByTenant(tenantId));

            Map<CustomerCategory, Long> byCategory = new EnumMap<>(CustomerCategory.class);
            for (Object[] row : customerRepository.countByCategory(tenantId)) {
                byCategory.put((CustomerCategory) row[0], ((Number) row[1]).longValue());
            }

            List<TenantSummary.ReceiptTypeTotal> breakdown = new ArrayList<>();
            for (Object[] row : receiptRepository.breakdownByVoucherType(tenantId)) {
                breakdown.add(new TenantSummary.ReceiptTypeTotal((String) row[0], ((Number) row[1]).longValue(),
                        Money.normalize(row[2])));
            }

            LedgerAggregates aggregates = LedgerAggregates.builder()
                    .openingBalance(Money.normalize(customerRepository.sumOpeningBalance(tenantId)))
                    .invoiceTotal(Money.normalize(invoiceTotals[0]))
                    .invoiceCount(((Number) invoiceTotals[1]).longValue())
                    .receiptTotal(Money.normalize(receiptTotals[0]))
                    .receiptCount(((Number) receiptTotals[1]).longValue())
                    .skippedCustomerCount(customerRepository.countInvalidCustomers(tenantId))
                    .customersByCategory(byCategory)
                    .receiptBreakdown(breakdown)
                    .build();
            return aggregationReporter.tenantSummary(tenantId, aggregates);
        } catch (DataAccessException e) {
            throw new DependencyUnavailableException("Summary queries failed for tenant " + tenantId, e);
        }
    }

    private static Object[] single(List<Object[]> rows) {
        if (rows.isEmpty()) {
            return new Object[] { null, 0L };
        }
        return rows.get(0);
    }
}
