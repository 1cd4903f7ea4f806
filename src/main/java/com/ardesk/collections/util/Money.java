package com.ardesk.collections.util;

import com.ardesk.collections.exception.LedgerDataException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point currency helpers. All amounts carry exactly two decimals.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    /**
     * Validates a ledger amount and normalises it to two decimals. Values with more precision are
     * rejected rather than rounded.
     */
    public static BigDecimal require(BigDecimal value, Long customerId, String field) {
        if (value == null) {
            throw new LedgerDataException(customerId, field, "amount is missing");
        }
        if (value.signum() < 0) {
            throw new LedgerDataException(customerId, field, "amount is negative (" + value.toPlainString() + ")");
        }
        try {
            return value.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new LedgerDataException(customerId, field,
                    "amount has more than " + SCALE + " decimals (" + value.toPlainString() + ")");
        }
    }

    // Optional amounts (opening balance, credit limit) default to zero
    public static BigDecimal orZero(BigDecimal value, Long customerId, String field) {
        return value == null ? ZERO : require(value, customerId, field);
    }

    public static BigDecimal of(String value) {
        return new BigDecimal(value).setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    // Results of aggregate queries, already two decimals in storage
    public static BigDecimal normalize(Object value) {
        if (value == null) {
            return ZERO;
        }
        BigDecimal amount = value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString());
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
