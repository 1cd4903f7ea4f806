package com.ardesk.collections.exception;

/**
 * A ledger row for one customer holds a value the engine cannot use (missing date, negative or
 * unparseable amount). The customer is skipped; the rest of the batch continues.
 */
public class LedgerDataException extends RuntimeException {

    private final Long customerId;
    private final String field;

    public LedgerDataException(Long customerId, String field, String message) {
        super("Customer " + customerId + ", field '" + field + "': " + message);
        this.customerId = customerId;
        this.field = field;
    }

    public Long getCustomerId() {
        return customerId;
    }

    public String getField() {
        return field;
    }
}
