package com.ardesk.collections.dto;

import com.ardesk.collections.engine.FollowUpBucket;
import com.ardesk.collections.model.CustomerCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * What the caller currently sees on the debtors screen. Null criteria match everything.
 */
@Value
@Builder
public class DebtorFilter {
    CustomerCategory category;
    String salesPerson;
    String search;
    FollowUpBucket bucket;
    @Builder.Default
    boolean outstandingOnly = true;

    public static DebtorFilter defaults() {
        return DebtorFilter.builder().build();
    }

    public boolean matches(DebtorSnapshot debtor) {
        if (outstandingOnly && debtor.getOutstandingBalance().signum() <= 0) {
            return false;
        }
        if (category != null && category != debtor.getCategory()) {
            return false;
        }
        if (salesPerson != null && !salesPerson.equalsIgnoreCase(debtor.getSalesPerson())) {
            return false;
        }
        if (search != null && !search.isBlank()
                && (debtor.getCustomerName() == null
                        || !debtor.getCustomerName().toLowerCase(Locale.ROOT)
                                .contains(search.trim().toLowerCase(Locale.ROOT)))) {
            return false;
        }
        return bucket == null || bucket == debtor.getFollowUpBucket();
    }
}
