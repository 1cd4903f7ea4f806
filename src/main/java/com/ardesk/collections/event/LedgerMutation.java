package com.ardesk.collections.event;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Writes that change ledger state, each with the read-models it makes stale.
 */
public enum LedgerMutation {
    INVOICE_POSTED(EnumSet.of(ReadModel.DEBTOR_SNAPSHOT, ReadModel.FOLLOW_UP_STATS, ReadModel.RISK_FORECAST,
            ReadModel.CATEGORY_ROLLUP, ReadModel.TENANT_SUMMARY, ReadModel.INVOICE_STATUS)),
    RECEIPT_RECORDED(EnumSet.of(ReadModel.DEBTOR_SNAPSHOT, ReadModel.FOLLOW_UP_STATS, ReadModel.RISK_FORECAST,
            ReadModel.CATEGORY_ROLLUP, ReadModel.TENANT_SUMMARY, ReadModel.INVOICE_STATUS)),
    FOLLOW_UP_LOGGED(EnumSet.of(ReadModel.DEBTOR_SNAPSHOT, ReadModel.FOLLOW_UP_STATS)),
    CUSTOMER_UPDATED(EnumSet.allOf(ReadModel.class)),
    CATEGORY_REASSIGNED(EnumSet.of(ReadModel.DEBTOR_SNAPSHOT, ReadModel.RISK_FORECAST, ReadModel.CATEGORY_ROLLUP,
            ReadModel.TENANT_SUMMARY)),
    TENANT_SETTING_CHANGED(EnumSet.of(ReadModel.RISK_FORECAST, ReadModel.INVOICE_STATUS));

    private final Set<ReadModel> invalidates;

    LedgerMutation(Set<ReadModel> invalidates) {
        this.invalidates = Collections.unmodifiableSet(invalidates);
    }

    public Set<ReadModel> getInvalidates() {
        return invalidates;
    }
}
