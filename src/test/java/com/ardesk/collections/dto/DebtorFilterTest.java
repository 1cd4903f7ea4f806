package com.ardesk.collections.dto;

import com.ardesk.collections.model.CustomerCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DebtorFilterTest {

    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    @Test
    void search_ShouldIgnoreCase_UnderTurkishLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        DebtorSnapshot titan = debtor("TITAN IMPEX", "10.00");

        assertTrue(DebtorFilter.builder().search("titan").build().matches(titan));
        assertTrue(DebtorFilter.builder().search("IMPEX").build().matches(debtor("Titan Impex", "10.00")));
    }

    @Test
    void search_ShouldRejectNonMatchingName() {
        assertFalse(DebtorFilter.builder().search("zen").build().matches(debtor("Titan Impex", "10.00")));
    }

    @Test
    void defaults_ShouldHideSettledCustomers() {
        assertFalse(DebtorFilter.defaults().matches(debtor("Titan Impex", "0.00")));
        assertTrue(DebtorFilter.builder().outstandingOnly(false).build().matches(debtor("Titan Impex", "0.00")));
    }

    private static DebtorSnapshot debtor(String name, String outstanding) {
        return DebtorSnapshot.builder()
                .customerId(1L)
                .customerName(name)
                .category(CustomerCategory.ALPHA)
                .outstandingBalance(new BigDecimal(outstanding))
                .build();
    }
}
