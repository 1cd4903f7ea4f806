package com.ardesk.collections.service;

import com.ardesk.collections.dto.ForecastReport;
import com.ardesk.collections.dto.RiskForecast;
import com.ardesk.collections.engine.AggregationReporter;
import com.ardesk.collections.engine.PaymentAllocator;
import com.ardesk.collections.engine.PaymentRiskForecaster;
import com.ardesk.collections.engine.RiskWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
public class RiskForecastService {

    private static final Comparator<RiskForecast> RISKIEST_FIRST = Comparator
            .comparingInt(RiskForecast::getStuckProbability).reversed()
            .thenComparing(RiskForecast::getCustomerName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(RiskForecast::getCustomerId);

    private final LedgerSnapshotService ledgerSnapshotService;
    private final CustomerComputationRunner runner;
    private final PaymentAllocator paymentAllocator;
    private final PaymentRiskForecaster forecaster;
    private final AggregationReporter aggregationReporter;
    private final TenantSettingsService tenantSettingsService;
    private final Clock clock;

    public RiskForecastService(LedgerSnapshotService ledgerSnapshotService,
            CustomerComputationRunner runner,
            PaymentAllocator paymentAllocator,
            PaymentRiskForecaster forecaster,
            AggregationReporter aggregationReporter,
            TenantSettingsService tenantSettingsService,
            Clock clock) {
        this.ledgerSnapshotService = ledgerSnapshotService;
        this.runner = runner;
        this.paymentAllocator = paymentAllocator;
        this.forecaster = forecaster;
        this.aggregationReporter = aggregationReporter;
        this.tenantSettingsService = tenantSettingsService;
        this.clock = clock;
    }

    /**
     * Forecasts for every invoiced customer, riskiest first, with band counts.
     */
    public ForecastReport forecast(String tenantId) {
        RiskWeights weights = tenantSettingsService.getRiskWeights(tenantId);
        LocalDate today = LocalDate.now(clock);
        TenantLedger ledger = ledgerSnapshotService.load(tenantId);

        ComputationResult<RiskForecast> computed = runner.run(ledger, customerLedger -> forecaster.forecast(
                customerLedger.getCustomer(),
                paymentAllocator.allocate(customerLedger.getCustomer(), customerLedger.getInvoices(),
                        customerLedger.getReceipts()),
                today,
                weights));

        List<RiskForecast> ranked = computed.getResults().stream().sorted(RISKIEST_FIRST).toList();
        log.debug("Tenant {}: {} forecasts, {} skipped", tenantId, ranked.size(), computed.getSkipped().size());
        return new ForecastReport(ranked, aggregationReporter.forecastSummary(ranked), computed.getSkipped());
    }
}
