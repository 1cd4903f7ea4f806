package com.ardesk.collections.event;

/**
 * Derived views the engine recomputes on read. Consumers that cache any of them listen for
 * {@link ReadModelsInvalidatedEvent}.
 */
public enum ReadModel {
    DEBTOR_SNAPSHOT,
    FOLLOW_UP_STATS,
    RISK_FORECAST,
    CATEGORY_ROLLUP,
    TENANT_SUMMARY,
    INVOICE_STATUS
}
