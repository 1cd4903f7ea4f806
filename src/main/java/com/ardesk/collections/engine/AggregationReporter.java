package com.ardesk.collections.engine;

import com.ardesk.collections.dto.BucketStat;
import com.ardesk.collections.dto.CategoryTotal;
import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.dto.ForecastSummary;
import com.ardesk.collections.dto.RiskForecast;
import com.ardesk.collections.dto.TenantSummary;
import com.ardesk.collections.model.CustomerCategory;
import com.ardesk.collections.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-customer results into the dashboard read-models. Every map carries all of its keys, with
 * zeroes where nothing fell in.
 */
@Component
public class AggregationReporter {

    /**
     * Count and outstanding total per category over exactly the given rows.
     */
    public Map<String, CategoryTotal> categoryRollup(List<DebtorSnapshot> debtors) {
        Map<CustomerCategory, long[]> counts = new EnumMap<>(CustomerCategory.class);
        Map<CustomerCategory, BigDecimal> balances = new EnumMap<>(CustomerCategory.class);
        for (CustomerCategory category : CustomerCategory.values()) {
            counts.put(category, new long[1]);
            balances.put(category, Money.ZERO);
        }
        for (DebtorSnapshot debtor : debtors) {
            counts.get(debtor.getCategory())[0]++;
            balances.merge(debtor.getCategory(), debtor.getOutstandingBalance(), BigDecimal::add);
        }

        Map<String, CategoryTotal> rollup = new LinkedHashMap<>();
        for (CustomerCategory category : CustomerCategory.values()) {
            rollup.put(category.getLabel(), new CategoryTotal(counts.get(category)[0], balances.get(category)));
        }
        return rollup;
    }

    public Map<String, BucketStat> followUpStats(List<DebtorSnapshot> debtors) {
        Map<FollowUpBucket, long[]> counts = new EnumMap<>(FollowUpBucket.class);
        Map<FollowUpBucket, BigDecimal> amounts = new EnumMap<>(FollowUpBucket.class);
        for (FollowUpBucket bucket : FollowUpBucket.values()) {
            counts.put(bucket, new long[1]);
            amounts.put(bucket, Money.ZERO);
        }
        for (DebtorSnapshot debtor : debtors) {
            counts.get(debtor.getFollowUpBucket())[0]++;
            amounts.merge(debtor.getFollowUpBucket(), debtor.getOutstandingBalance(), BigDecimal::add);
        }

        Map<String, BucketStat> stats = new LinkedHashMap<>();
        for (FollowUpBucket bucket : FollowUpBucket.values()) {
            stats.put(bucket.getKey(), new BucketStat(counts.get(bucket)[0], amounts.get(bucket)));
        }
        return stats;
    }

    public ForecastSummary forecastSummary(List<RiskForecast> forecasts) {
        long high = 0;
        long medium = 0;
        long low = 0;
        for (RiskForecast forecast : forecasts) {
            switch (forecast.getRiskBand()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new ForecastSummary(high, medium, low);
    }

    public TenantSummary tenantSummary(String tenantId, LedgerAggregates aggregates) {
        List<TenantSummary.CategoryCount> categories = new ArrayList<>();
        long customerCount = 0;
        for (CustomerCategory category : CustomerCategory.values()) {
            long count = aggregates.getCustomersByCategory().getOrDefault(category, 0L);
            categories.add(new TenantSummary.CategoryCount(category.getLabel(), count));
            customerCount += count;
        }

        BigDecimal opening = aggregates.getOpeningBalance();
        BigDecimal invoiced = aggregates.getInvoiceTotal();
        BigDecimal received = aggregates.getReceiptTotal();

        return TenantSummary.builder()
                .tenantId(tenantId)
                .openingBalance(opening)
                .invoiceTotal(invoiced)
                .receiptTotal(received)
                .outstandingBalance(opening.add(invoiced).subtract(received))
                .customerCount(customerCount)
                .skippedCustomerCount(aggregates.getSkippedCustomerCount())
                .invoiceCount(aggregates.getInvoiceCount())
                .receiptCount(aggregates.getReceiptCount())
                .categoryBreakdown(categories)
                .receiptBreakdown(aggregates.getReceiptBreakdown())
                .avgInvoiceValue(average(invoiced, aggregates.getInvoiceCount()))
                .avgReceiptValue(average(received, aggregates.getReceiptCount()))
                .build();
    }

    static BigDecimal average(BigDecimal total, long count) {
        if (count == 0) {
            return Money.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), Money.SCALE, RoundingMode.HALF_UP);
    }
}
