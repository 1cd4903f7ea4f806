package com.ardesk.collections.service;

import com.ardesk.collections.dto.SkippedCustomer;
import com.ardesk.collections.engine.CustomerLedger;
import com.ardesk.collections.exception.AggregationFailedException;
import com.ardesk.collections.exception.LedgerDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs one computation per customer of a snapshot. A customer whose rows hold bad data is skipped
 * and reported; only when every customer fails does the whole batch fail.
 */
@Slf4j
@Component
public class CustomerComputationRunner {

    private final TenantWorkDispatcher dispatcher;

    public CustomerComputationRunner(TenantWorkDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * @param computation returns empty when the customer has nothing to report
     * @throws AggregationFailedException when the snapshot is non-empty and every customer failed
     */
    public <R> ComputationResult<R> run(TenantLedger ledger, Function<CustomerLedger, Optional<R>> computation) {
        String tenantId = ledger.getTenantId();
        List<Outcome<R>> outcomes = dispatcher.map(tenantId, ledger.getCustomers(), customer -> {
            try {
                return new Outcome<R>(computation.apply(customer), null);
            } catch (LedgerDataException e) {
                log.warn("Tenant {}: skipping customer {} ({}): {}", tenantId, e.getCustomerId(), e.getField(),
                        e.getMessage());
                return new Outcome<R>(Optional.empty(),
                        new SkippedCustomer(e.getCustomerId(), e.getField(), e.getMessage()));
            }
        });

        List<R> results = new ArrayList<>();
        List<SkippedCustomer> skipped = new ArrayList<>();
        for (Outcome<R> outcome : outcomes) {
            if (outcome.failure != null) {
                skipped.add(outcome.failure);
            } else {
                outcome.result.ifPresent(results::add);
            }
        }

        if (!outcomes.isEmpty() && skipped.size() == outcomes.size()) {
            throw new AggregationFailedException(tenantId, skipped.size());
        }
        if (!skipped.isEmpty()) {
            log.info("Tenant {}: {} of {} customers skipped due to data errors", tenantId, skipped.size(),
                    outcomes.size());
        }
        return new ComputationResult<>(results, skipped);
    }

    private static final class Outcome<R> {
        private final Optional<R> result;
        private final SkippedCustomer failure;

        private Outcome(Optional<R> result, SkippedCustomer failure) {
            this.result = result;
            this.failure = failure;
        }
    }
}
