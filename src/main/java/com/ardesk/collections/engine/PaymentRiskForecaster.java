package com.ardesk.collections.engine;

import com.ardesk.collections.dto.RiskForecast;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Scores how likely a customer's payment is to get stuck, from their payment punctuality.
 *
 * <pre>
 * latePaymentRate  = 1 - (onTimeRate ?? 0.5)
 * delayFactor      = min(1, avgDelayDays / delaySaturationDays)
 * volumeFactor     = min(1, unpaidInvoices / volumeSaturationInvoices)
 * amountFactor     = creditLimit &gt; 0 ? min(1, unpaidAmount / creditLimit) : 0
 * stuckProbability = round(100 * weighted sum)
 * </pre>
 */
@Component
public class PaymentRiskForecaster {

    private static final int FACTOR_SCALE = 10;
    private static final BigDecimal NEUTRAL_ON_TIME_RATE = new BigDecimal("0.5");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Empty when the customer has never been invoiced.
     */
    public Optional<RiskForecast> forecast(Customer customer, List<InvoicePosition> positions, LocalDate today,
            RiskWeights weights) {
        if (positions.isEmpty()) {
            return Optional.empty();
        }

        int fullyPaid = 0;
        int onTime = 0;
        int late = 0;
        long totalDelayDays = 0;
        int unpaidInvoices = 0;
        BigDecimal unpaidAmount = Money.ZERO;

        for (InvoicePosition position : positions) {
            if (position.isPaidInFull()) {
                fullyPaid++;
                if (!position.getFullyPaidOn().isAfter(position.getDueDate())) {
                    onTime++;
                } else {
                    late++;
                    totalDelayDays += ChronoUnit.DAYS.between(position.getDueDate(), position.getFullyPaidOn());
                }
            }
            if (position.isUnpaid()) {
                unpaidInvoices++;
                unpaidAmount = unpaidAmount.add(position.getBalanceDue());
            }
        }

        BigDecimal onTimeRate = fullyPaid == 0 ? null
                : BigDecimal.valueOf(onTime).divide(BigDecimal.valueOf(fullyPaid), FACTOR_SCALE, RoundingMode.HALF_UP);
        BigDecimal avgDelayDays = late == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(totalDelayDays).divide(BigDecimal.valueOf(late), FACTOR_SCALE, RoundingMode.HALF_UP);

        BigDecimal creditLimit = customer.getCreditLimit() == null ? BigDecimal.ZERO : customer.getCreditLimit();
        int score = stuckProbability(onTimeRate, avgDelayDays, unpaidInvoices, unpaidAmount, creditLimit, weights);

        LocalDate expectedPaymentDate = unpaidInvoices > 0
                ? today.plusDays(avgDelayDays.setScale(0, RoundingMode.HALF_UP).longValueExact())
                : null;

        return Optional.of(RiskForecast.builder()
                .customerId(customer.getId())
                .customerName(customer.getName())
                .category(customer.getCategory())
                .stuckProbability(score)
                .riskBand(RiskBand.of(score))
                .expectedPaymentDate(expectedPaymentDate)
                .onTimeRate(onTimeRate == null ? null : onTimeRate.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP))
                .avgDelayDays(avgDelayDays.setScale(1, RoundingMode.HALF_UP))
                .unpaidInvoices(unpaidInvoices)
                .unpaidAmount(unpaidAmount)
                .build());
    }

    /**
     * @param onTimeRate fraction 0..1 of fully paid invoices settled by their due date, null if none
     */
    public int stuckProbability(BigDecimal onTimeRate, BigDecimal avgDelayDays, int unpaidInvoices,
            BigDecimal unpaidAmount, BigDecimal creditLimit, RiskWeights weights) {
        BigDecimal latePaymentRate = BigDecimal.ONE.subtract(onTimeRate == null ? NEUTRAL_ON_TIME_RATE : onTimeRate);
        BigDecimal delayFactor = capped(avgDelayDays, BigDecimal.valueOf(weights.getDelaySaturationDays()));
        BigDecimal volumeFactor = capped(BigDecimal.valueOf(unpaidInvoices),
                BigDecimal.valueOf(weights.getVolumeSaturationInvoices()));
        BigDecimal amountFactor = creditLimit != null && creditLimit.signum() > 0
                ? capped(unpaidAmount, creditLimit)
                : BigDecimal.ZERO;

        BigDecimal weighted = weights.getLatePaymentWeight().multiply(latePaymentRate)
                .add(weights.getDelayWeight().multiply(delayFactor))
                .add(weights.getVolumeWeight().multiply(volumeFactor))
                .add(weights.getAmountWeight().multiply(amountFactor));

        int score = weighted.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).intValueExact();
        return Math.max(0, Math.min(100, score));
    }

    private static BigDecimal capped(BigDecimal value, BigDecimal saturation) {
        if (value.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return value.divide(saturation, FACTOR_SCALE, RoundingMode.HALF_UP).min(BigDecimal.ONE);
    }
}
