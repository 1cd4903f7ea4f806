package com.ardesk.collections.service;

import com.ardesk.collections.config.CollectionsProperties;
import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.dto.RecalculationSummary;
import com.ardesk.collections.engine.CategoryClassifier;
import com.ardesk.collections.engine.CategoryDecision;
import com.ardesk.collections.engine.CustomerLedger;
import com.ardesk.collections.engine.DebtorCalculator;
import com.ardesk.collections.event.LedgerMutation;
import com.ardesk.collections.event.ReadModelsInvalidatedEvent;
import com.ardesk.collections.exception.AggregationFailedException;
import com.ardesk.collections.exception.DependencyUnavailableException;
import com.ardesk.collections.exception.LedgerDataException;
import com.ardesk.collections.model.CategoryRule;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.repository.CategoryRuleRepository;
import com.ardesk.collections.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Re-applies a tenant's category rules to its customers, one page at a time.
 * <p>
 * Each reassignment commits on its own. When a page runs past its deadline the pass stops and
 * reports the page to resume from; running that page again is harmless.
 */
@Slf4j
@Service
public class CategoryRecalculationService {

    private final CustomerRepository customerRepository;
    private final CategoryRuleRepository categoryRuleRepository;
    private final LedgerSnapshotService ledgerSnapshotService;
    private final DebtorCalculator debtorCalculator;
    private final CategoryClassifier categoryClassifier;
    private final CategoryAssignmentService categoryAssignmentService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final CollectionsProperties properties;
    private final Clock clock;

    public CategoryRecalculationService(CustomerRepository customerRepository,
            CategoryRuleRepository categoryRuleRepository,
            LedgerSnapshotService ledgerSnapshotService,
            DebtorCalculator debtorCalculator,
            CategoryClassifier categoryClassifier,
            CategoryAssignmentService categoryAssignmentService,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher,
            CollectionsProperties properties,
            Clock clock) {
        this.customerRepository = customerRepository;
        this.categoryRuleRepository = categoryRuleRepository;
        this.ledgerSnapshotService = ledgerSnapshotService;
        this.debtorCalculator = debtorCalculator;
        this.categoryClassifier = categoryClassifier;
        this.categoryAssignmentService = categoryAssignmentService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public List<CategoryRule> rules(String tenantId) {
        try {
            return categoryRuleRepository.findByTenantIdOrderByPriorityAscIdAsc(tenantId);
        } catch (DataAccessException e) {
            throw new DependencyUnavailableException("Category rules unavailable for tenant " + tenantId, e);
        }
    }

    public RecalculationSummary recalculate(String tenantId, int fromPage) {
        if (fromPage < 0) {
            throw new IllegalArgumentException("fromPage must not be negative");
        }
        int pageSize = Math.max(1, properties.getRecalculation().getPageSize());
        long pageDeadlineNanos = properties.getRecalculation().getPageDeadline().toNanos();
        List<CategoryRule> rules = rules(tenantId);
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("Tenant {}: category recalculation from page {} with {} rules", tenantId, fromPage, rules.size());

        Tally tally = new Tally();
        int page = fromPage;
        int pagesProcessed = 0;
        Integer resumeFromPage = null;

        while (true) {
            long deadline = System.nanoTime() + pageDeadlineNanos;
            Page<Customer> customers = fetchPage(tenantId, page, pageSize);
            if (!customers.hasContent()) {
                break;
            }

            TenantLedger ledger = ledgerSnapshotService.load(tenantId, customers.getContent());
            boolean first = true;
            boolean expired = false;
            for (CustomerLedger customerLedger : ledger.getCustomers()) {
                // At least one customer per page, so every pass makes progress
                if (!first && System.nanoTime() - deadline > 0) {
                    expired = true;
                    break;
                }
                first = false;
                apply(tenantId, customerLedger, rules, now, tally);
            }

            if (expired) {
                resumeFromPage = page;
                log.warn("Tenant {}: page {} exceeded its deadline; resume from page {}", tenantId, page, page);
                break;
            }
            pagesProcessed++;
            log.debug("Tenant {}: page {} done ({} customers)", tenantId, page, customers.getNumberOfElements());
            if (!customers.hasNext()) {
                break;
            }
            page++;
        }

        if (tally.processed > 0 && tally.dataErrors == tally.processed && resumeFromPage == null) {
            throw new AggregationFailedException(tenantId, tally.dataErrors);
        }
        if (tally.reassigned > 0) {
            eventPublisher.publishEvent(ReadModelsInvalidatedEvent.of(tenantId, LedgerMutation.CATEGORY_REASSIGNED));
        }

        log.info("Tenant {}: recalculation {}: reassigned={}, unchanged={}, override={}, dataErrors={}",
                tenantId, resumeFromPage == null ? "complete" : "paused", tally.reassigned, tally.unchanged,
                tally.skippedOverride, tally.dataErrors);
        return RecalculationSummary.builder()
                .tenantId(tenantId)
                .reassigned(tally.reassigned)
                .unchanged(tally.unchanged)
                .skippedOverride(tally.skippedOverride)
                .skippedDataError(tally.dataErrors)
                .pagesProcessed(pagesProcessed)
                .complete(resumeFromPage == null)
                .resumeFromPage(resumeFromPage)
                .build();
    }

    private void apply(String tenantId, CustomerLedger customerLedger, List<CategoryRule> rules, LocalDateTime now,
            Tally tally) {
        tally.processed++;
        Customer customer = customerLedger.getCustomer();
        CategoryDecision decision;
        try {
            DebtorSnapshot snapshot = debtorCalculator.snapshot(customerLedger, now);
            decision = categoryClassifier.decide(customer, rules, snapshot.getOutstandingBalance(),
                    snapshot.getOverdueDays());
        } catch (LedgerDataException e) {
            log.warn("Tenant {}: skipping customer {} ({}): {}", tenantId, e.getCustomerId(), e.getField(),
                    e.getMessage());
            tally.dataErrors++;
            return;
        }

        switch (decision.getOutcome()) {
            case SKIPPED_OVERRIDE -> tally.skippedOverride++;
            case UNCHANGED -> tally.unchanged++;
            case REASSIGNED -> {
                if (write(tenantId, decision)) {
                    tally.reassigned++;
                    auditService.log(tenantId, AuditService.CATEGORY_REASSIGNED, String.format(
                            "Customer %d (%s): %s -> %s (rule priority %d)", customer.getId(), customer.getName(),
                            decision.getCurrentCategory().getLabel(), decision.getTargetCategory().getLabel(),
                            decision.getMatchedRulePriority()));
                } else {
                    // Overridden or changed by someone else since the page was read
                    log.debug("Tenant {}: customer {} not updated; override set concurrently", tenantId,
                            customer.getId());
                    tally.skippedOverride++;
                }
            }
        }
    }

    private boolean write(String tenantId, CategoryDecision decision) {
        try {
            return categoryAssignmentService.assign(tenantId, decision.getCustomerId(), decision.getTargetCategory());
        } catch (DataAccessException | TransactionException e) {
            throw new DependencyUnavailableException("Category update failed for customer "
                    + decision.getCustomerId(), e);
        }
    }

    private Page<Customer> fetchPage(String tenantId, int page, int pageSize) {
        try {
            return customerRepository.findByTenantId(tenantId, PageRequest.of(page, pageSize, Sort.by("id")));
        } catch (DataAccessException e) {
            throw new DependencyUnavailableException("Customers unavailable for tenant " + tenantId, e);
        }
    }

    private static final class Tally {
        int processed;
        int reassigned;
        int unchanged;
        int skippedOverride;
        int dataErrors;
    }
}
