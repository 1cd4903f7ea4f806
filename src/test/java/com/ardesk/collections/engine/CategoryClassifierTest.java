package com.ardesk.collections.engine;

import com.ardesk.collections.model.CategoryRule;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.CustomerCategory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.ardesk.collections.LedgerFixtures.customer;
import static org.junit.jupiter.api.Assertions.*;

class CategoryClassifierTest {

    private final CategoryClassifier classifier = new CategoryClassifier();

    @Test
    void decide_ShouldReassign_WhenFirstRuleMatches() {
        Customer c = customer(1L, "Bharat");
        c.setCategory(CustomerCategory.BETA);
        CategoryRule delta = rule(1L, 1, "500000", null, 60, null, CustomerCategory.DELTA);

        CategoryDecision decision = classifier.decide(c, List.of(delta), new BigDecimal("600000.00"), 90);

        assertEquals(CategoryDecision.Outcome.REASSIGNED, decision.getOutcome());
        assertEquals(CustomerCategory.BETA, decision.getCurrentCategory());
        assertEquals(CustomerCategory.DELTA, decision.getTargetCategory());
        assertEquals(1, decision.getMatchedRulePriority());
    }

    @Test
    void decide_ShouldLeaveOverriddenCustomerAlone() {
        Customer c = customer(1L, "Pinned");
        c.setCategory(CustomerCategory.BETA);
        c.setCategoryManualOverride(true);

        CategoryDecision decision = classifier.decide(c,
                List.of(rule(1L, 1, null, null, null, null, CustomerCategory.DELTA)), new BigDecimal("1.00"), 400);

        assertEquals(CategoryDecision.Outcome.SKIPPED_OVERRIDE, decision.getOutcome());
        assertEquals(CustomerCategory.BETA, decision.getTargetCategory());
    }

    @Test
    void decide_ShouldBeUnchanged_WhenNoRuleMatches() {
        Customer c = customer(1L, "Small");
        CategoryDecision decision = classifier.decide(c,
                List.of(rule(1L, 1, "500000", null, 60, null, CustomerCategory.DELTA)), new BigDecimal("10.00"), 5);

        assertEquals(CategoryDecision.Outcome.UNCHANGED, decision.getOutcome());
        assertNull(decision.getMatchedRulePriority());
    }

    @Test
    void firstMatch_ShouldEvaluateByPriorityNotListOrder() {
        CategoryRule gamma = rule(10L, 2, "1000", null, null, null, CustomerCategory.GAMMA);
        CategoryRule delta = rule(11L, 1, "1000", null, null, null, CustomerCategory.DELTA);

        assertEquals(CustomerCategory.DELTA,
                classifier.firstMatch(List.of(gamma, delta), new BigDecimal("5000.00"), 0).orElseThrow()
                        .getTargetCategory());
    }

    @Test
    void matches_ShouldTreatBoundsAsInclusive() {
        CategoryRule rule = rule(1L, 1, "100.00", "200.00", 30, 60, CustomerCategory.GAMMA);

        assertTrue(classifier.matches(rule, new BigDecimal("100.00"), 30));
        assertTrue(classifier.matches(rule, new BigDecimal("200.00"), 60));
        assertFalse(classifier.matches(rule, new BigDecimal("99.99"), 30));
        assertFalse(classifier.matches(rule, new BigDecimal("200.01"), 30));
        assertFalse(classifier.matches(rule, new BigDecimal("150.00"), 29));
        assertFalse(classifier.matches(rule, new BigDecimal("150.00"), 61));
    }

    @Test
    void overdueDays_ShouldCountFromOldestUnpaidDueDate() {
        LocalDate today = LocalDate.of(2025, 3, 10);
        List<InvoicePosition> positions = List.of(
                new InvoicePosition(1L, "A", new BigDecimal("10.00"), today.minusDays(200), today.minusDays(170),
                        new BigDecimal("10.00"), today.minusDays(100)),
                new InvoicePosition(2L, "B", new BigDecimal("10.00"), today.minusDays(120), today.minusDays(90),
                        new BigDecimal("5.00"), null),
                new InvoicePosition(3L, "C", new BigDecimal("10.00"), today.minusDays(10), today.plusDays(20),
                        new BigDecimal("0.00"), null));

        assertEquals(90, classifier.overdueDays(positions, today));
        assertEquals(0, classifier.overdueDays(positions.subList(2, 3), today));
        assertEquals(0, classifier.overdueDays(List.of(), today));
    }

    static CategoryRule rule(Long id, int priority, String min, String max, Integer minDays, Integer maxDays,
            CustomerCategory target) {
        CategoryRule rule = new CategoryRule();
        rule.setId(id);
        rule.setTenantId("acme");
        rule.setPriority(priority);
        rule.setMinBalance(min == null ? null : new BigDecimal(min));
        rule.setMaxBalance(max == null ? null : new BigDecimal(max));
        rule.setMinOverdueDays(minDays);
        rule.setMaxOverdueDays(maxDays);
        rule.setTargetCategory(target);
        return rule;
    }
}
