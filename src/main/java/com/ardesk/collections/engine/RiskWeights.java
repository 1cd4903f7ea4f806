package com.ardesk.collections.engine;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Coefficients of the stuck-probability score. The four weights are non-negative and sum to 1, which
 * keeps the score within 0..100.
 */
@Value
public class RiskWeights {
    BigDecimal latePaymentWeight;
    BigDecimal delayWeight;
    BigDecimal volumeWeight;
    BigDecimal amountWeight;
    int delaySaturationDays;
    int volumeSaturationInvoices;

    public static RiskWeights defaults() {
        return new RiskWeights(new BigDecimal("0.40"), new BigDecimal("0.30"), new BigDecimal("0.15"),
                new BigDecimal("0.15"), 60, 10);
    }

    /**
     * @throws IllegalArgumentException when a weight is missing or negative, the weights do not sum
     *                                  to 1, or a saturation point is not positive
     */
    public RiskWeights validated() {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal weight : new BigDecimal[] { latePaymentWeight, delayWeight, volumeWeight, amountWeight }) {
            if (weight == null || weight.signum() < 0) {
                throw new IllegalArgumentException("Risk weights must be non-negative: " + this);
            }
            sum = sum.add(weight);
        }
        if (sum.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("Risk weights must sum to 1 but sum to " + sum.toPlainString());
        }
        if (delaySaturationDays <= 0 || volumeSaturationInvoices <= 0) {
            throw new IllegalArgumentException("Saturation points must be positive: " + this);
        }
        return this;
    }
}
