package com.ardesk.collections.engine;

import com.ardesk.collections.dto.BucketStat;
import com.ardesk.collections.dto.CategoryTotal;
import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.dto.ForecastSummary;
import com.ardesk.collections.dto.RiskForecast;
import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.model.CustomerCategory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregationReporterTest {

    private final AggregationReporter reporter = new AggregationReporter();

    @Test
    void categoryRollup_ShouldSumToVisibleRows() {
        List<DebtorSnapshot> debtors = List.of(
                debtor(1L, CustomerCategory.BETA, "1200.50", FollowUpBucket.OVERDUE),
                debtor(2L, CustomerCategory.BETA, "799.50", FollowUpBucket.DUE_TODAY),
                debtor(3L, CustomerCategory.DELTA, "10000.00", FollowUpBucket.NO_FOLLOW_UP));

        Map<String, CategoryTotal> rollup = reporter.categoryRollup(debtors);

        assertEquals(List.of("Alpha", "Beta", "Gamma", "Delta"), List.copyOf(rollup.keySet()));
        assertEquals(new CategoryTotal(0, new BigDecimal("0.00")), rollup.get("Alpha"));
        assertEquals(new CategoryTotal(2, new BigDecimal("2000.00")), rollup.get("Beta"));
        assertEquals(new CategoryTotal(1, new BigDecimal("10000.00")), rollup.get("Delta"));
        assertEquals(3, rollup.values().stream().mapToLong(CategoryTotal::getCount).sum());
        assertEquals(new BigDecimal("12000.00"),
                rollup.values().stream().map(CategoryTotal::getTotalBalance).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Test
    void followUpStats_ShouldListAllSevenBuckets() {
        Map<String, BucketStat> stats = reporter.followUpStats(List.of(
                debtor(1L, CustomerCategory.ALPHA, "100.00", FollowUpBucket.OVERDUE),
                debtor(2L, CustomerCategory.ALPHA, "50.00", FollowUpBucket.OVERDUE)));

        assertEquals(7, stats.size());
        assertEquals(new BucketStat(2, new BigDecimal("150.00")), stats.get("overdue"));
        assertEquals(new BucketStat(0, new BigDecimal("0.00")), stats.get("unscheduledFuture"));
    }

    @Test
    void forecastSummary_ShouldCountBands() {
        ForecastSummary summary = reporter.forecastSummary(List.of(forecast(80), forecast(70), forecast(30),
                forecast(29)));

        assertEquals(new ForecastSummary(2, 1, 1), summary);
    }

    @Test
    void tenantSummary_ShouldAverageAndAvoidDivisionByZero() {
        LedgerAggregates aggregates = LedgerAggregates.builder()
                .openingBalance(new BigDecimal("1000.00"))
                .invoiceTotal(new BigDecimal("1000.00"))
                .invoiceCount(3)
                .receiptTotal(new BigDecimal("0.00"))
                .receiptCount(0)
                .customersByCategory(Map.of(CustomerCategory.ALPHA, 2L, CustomerCategory.GAMMA, 1L))
                .receiptBreakdown(List.of())
                .build();

        TenantSummary summary = reporter.tenantSummary("acme", aggregates);

        assertEquals(new BigDecimal("333.33"), summary.getAvgInvoiceValue());
        assertEquals(new BigDecimal("0.00"), summary.getAvgReceiptValue());
        assertEquals(new BigDecimal("2000.00"), summary.getOutstandingBalance());
        assertEquals(3, summary.getCustomerCount());
        assertEquals(4, summary.getCategoryBreakdown().size());
        assertEquals(0, summary.getCategoryBreakdown().get(1).getCount());
    }

    private static DebtorSnapshot debtor(Long id, CustomerCategory category, String outstanding,
            FollowUpBucket bucket) {
        return DebtorSnapshot.builder()
                .customerId(id)
                .customerName("Customer " + id)
                .category(category)
                .outstandingBalance(new BigDecimal(outstanding))
                .followUpBucket(bucket)
                .build();
    }

    private static RiskForecast forecast(int score) {
        return RiskForecast.builder().stuckProbability(score).riskBand(RiskBand.of(score)).build();
    }
}
