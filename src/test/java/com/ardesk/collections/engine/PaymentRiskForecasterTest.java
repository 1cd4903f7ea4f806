package com.ardesk.collections.engine;

import com.ardesk.collections.dto.RiskForecast;
import com.ardesk.collections.model.Customer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ardesk.collections.LedgerFixtures.customer;
import static org.junit.jupiter.api.Assertions.*;

class PaymentRiskForecasterTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final PaymentRiskForecaster forecaster = new PaymentRiskForecaster();
    private final RiskWeights weights = RiskWeights.defaults();

    @Test
    void stuckProbability_ShouldWeighAllFourFactors() {
        int score = forecaster.stuckProbability(new BigDecimal("0.4"), new BigDecimal("30"), 5,
                new BigDecimal("50000.00"), new BigDecimal("100000.00"), weights);

        assertEquals(54, score);
        assertEquals(RiskBand.MEDIUM, RiskBand.of(score));
    }

    @Test
    void stuckProbability_ShouldUseNeutralRate_WhenNothingPaidInFull() {
        int score = forecaster.stuckProbability(null, BigDecimal.ZERO, 0, new BigDecimal("0.00"), null, weights);

        assertEquals(20, score);
        assertEquals(RiskBand.LOW, RiskBand.of(score));
    }

    @Test
    void stuckProbability_ShouldIgnoreAmount_WhenNoCreditLimit() {
        int withoutLimit = forecaster.stuckProbability(BigDecimal.ONE, BigDecimal.ZERO, 0,
                new BigDecimal("999999.00"), BigDecimal.ZERO, weights);

        assertEquals(0, withoutLimit);
    }

    @Test
    void stuckProbability_ShouldSaturateAt100() {
        int score = forecaster.stuckProbability(BigDecimal.ZERO, new BigDecimal("400"), 50,
                new BigDecimal("900000.00"), new BigDecimal("1000.00"), weights);

        assertEquals(100, score);
    }

    @Test
    void stuckProbability_ShouldNeverDecrease_AsDelayOrUnpaidCountGrows() {
        int previous = -1;
        for (int delay = 0; delay <= 120; delay += 3) {
            int score = forecaster.stuckProbability(new BigDecimal("0.5"), BigDecimal.valueOf(delay), 2,
                    new BigDecimal("100.00"), new BigDecimal("1000.00"), weights);
            assertTrue(score >= previous, "delay " + delay);
            assertTrue(score >= 0 && score <= 100);
            previous = score;
        }

        previous = -1;
        for (int unpaid = 0; unpaid <= 25; unpaid++) {
            int score = forecaster.stuckProbability(new BigDecimal("0.5"), new BigDecimal("10"), unpaid,
                    new BigDecimal("100.00"), new BigDecimal("1000.00"), weights);
            assertTrue(score >= previous, "unpaid " + unpaid);
            previous = score;
        }
    }

    @Test
    void riskBand_ShouldSplitAtThirtyAndSeventy() {
        assertEquals(RiskBand.LOW, RiskBand.of(0));
        assertEquals(RiskBand.LOW, RiskBand.of(29));
        assertEquals(RiskBand.MEDIUM, RiskBand.of(30));
        assertEquals(RiskBand.MEDIUM, RiskBand.of(69));
        assertEquals(RiskBand.HIGH, RiskBand.of(70));
        assertEquals(RiskBand.HIGH, RiskBand.of(100));
    }

    @Test
    void forecast_ShouldDeriveMetricsFromPositions() {
        Customer c = customer(1L, "Bharat");
        c.setCreditLimit(new BigDecimal("100000.00"));
        LocalDate due = LocalDate.of(2024, 12, 1);

        List<InvoicePosition> positions = new ArrayList<>();
        // two on time, three late by 20, 30 and 40 days
        positions.add(paid(1L, due, due.minusDays(2)));
        positions.add(paid(2L, due, due));
        positions.add(paid(3L, due, due.plusDays(20)));
        positions.add(paid(4L, due, due.plusDays(30)));
        positions.add(paid(5L, due, due.plusDays(40)));
        for (long id = 6; id <= 10; id++) {
            positions.add(new InvoicePosition(id, "INV-" + id, new BigDecimal("10000.00"), due.minusDays(30), due,
                    new BigDecimal("0.00"), null));
        }

        RiskForecast forecast = forecaster.forecast(c, positions, TODAY, weights).orElseThrow();

        assertEquals(54, forecast.getStuckProbability());
        assertEquals(RiskBand.MEDIUM, forecast.getRiskBand());
        assertEquals(new BigDecimal("40.0"), forecast.getOnTimeRate());
        assertEquals(new BigDecimal("30.0"), forecast.getAvgDelayDays());
        assertEquals(5, forecast.getUnpaidInvoices());
        assertEquals(new BigDecimal("50000.00"), forecast.getUnpaidAmount());
        assertEquals(TODAY.plusDays(30), forecast.getExpectedPaymentDate());
    }

    @Test
    void forecast_ShouldHaveNoExpectedDate_WhenEverythingPaid() {
        LocalDate due = LocalDate.of(2025, 1, 1);
        RiskForecast forecast = forecaster.forecast(customer(1L, "Settled"), List.of(paid(1L, due, due)), TODAY,
                weights).orElseThrow();

        assertNull(forecast.getExpectedPaymentDate());
        assertEquals(new BigDecimal("100.0"), forecast.getOnTimeRate());
        assertEquals(0, forecast.getStuckProbability());
    }

    @Test
    void forecast_ShouldBeEmpty_WhenNeverInvoiced() {
        Optional<RiskForecast> forecast = forecaster.forecast(customer(1L, "New"), List.of(), TODAY, weights);

        assertTrue(forecast.isEmpty());
    }

    @Test
    void forecast_ShouldBeIdenticalOnRepeat() {
        LocalDate due = LocalDate.of(2025, 1, 1);
        List<InvoicePosition> positions = List.of(paid(1L, due, due.plusDays(7)),
                new InvoicePosition(2L, "INV-2", new BigDecimal("500.00"), due, due, new BigDecimal("100.00"), null));

        assertEquals(forecaster.forecast(customer(1L, "Same"), positions, TODAY, weights),
                forecaster.forecast(customer(1L, "Same"), positions, TODAY, weights));
    }

    private static InvoicePosition paid(Long id, LocalDate due, LocalDate paidOn) {
        return new InvoicePosition(id, "INV-" + id, new BigDecimal("1000.00"), due.minusDays(30), due,
                new BigDecimal("1000.00"), paidOn);
    }
}
