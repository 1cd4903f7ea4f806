package com.ardesk.collections.engine;

import com.ardesk.collections.model.CategoryRule;
import com.ardesk.collections.model.Customer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Applies prioritised tier rules to a customer's balance and overdue age.
 */
@Slf4j
@Component
public class CategoryClassifier {

    private static final Comparator<CategoryRule> BY_PRIORITY = Comparator
            .comparingInt(CategoryRule::getPriority)
            .thenComparing(CategoryRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public CategoryDecision decide(Customer customer, List<CategoryRule> rules, BigDecimal balance, long overdueDays) {
        if (customer.isCategoryManualOverride()) {
            return new CategoryDecision(customer.getId(), CategoryDecision.Outcome.SKIPPED_OVERRIDE,
                    customer.getCategory(), customer.getCategory(), null);
        }

        Optional<CategoryRule> match = firstMatch(rules, balance, overdueDays);
        if (match.isEmpty() || match.get().getTargetCategory() == customer.getCategory()) {
            return new CategoryDecision(customer.getId(), CategoryDecision.Outcome.UNCHANGED,
                    customer.getCategory(), customer.getCategory(),
                    match.map(CategoryRule::getPriority).orElse(null));
        }

        CategoryRule rule = match.get();
        return new CategoryDecision(customer.getId(), CategoryDecision.Outcome.REASSIGNED,
                customer.getCategory(), rule.getTargetCategory(), rule.getPriority());
    }

    public Optional<CategoryRule> firstMatch(List<CategoryRule> rules, BigDecimal balance, long overdueDays) {
        List<CategoryRule> ordered = new ArrayList<>(rules);
        ordered.sort(BY_PRIORITY);
        for (CategoryRule rule : ordered) {
            if (matches(rule, balance, overdueDays)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    boolean matches(CategoryRule rule, BigDecimal balance, long overdueDays) {
        if (rule.getTargetCategory() == null) {
            log.warn("Category rule {} (priority {}) has no target category; ignored", rule.getId(), rule.getPriority());
            return false;
        }
        if (rule.getMinBalance() != null && balance.compareTo(rule.getMinBalance()) < 0) {
            return false;
        }
        if (rule.getMaxBalance() != null && balance.compareTo(rule.getMaxBalance()) > 0) {
            return false;
        }
        if (rule.getMinOverdueDays() != null && overdueDays < rule.getMinOverdueDays()) {
            return false;
        }
        return rule.getMaxOverdueDays() == null || overdueDays <= rule.getMaxOverdueDays();
    }

    /**
     * Days since the due date of the oldest unpaid invoice; 0 when nothing is unpaid or not yet due.
     */
    public long overdueDays(List<InvoicePosition> positions, LocalDate today) {
        LocalDate oldestDue = null;
        for (InvoicePosition position : positions) {
            if (position.isUnpaid() && (oldestDue == null || position.getDueDate().isBefore(oldestDue))) {
                oldestDue = position.getDueDate();
            }
        }
        if (oldestDue == null) {
            return 0;
        }
        return Math.max(0, ChronoUnit.DAYS.between(oldestDue, today));
    }
}
