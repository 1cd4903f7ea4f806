package com.ardesk.collections.dto;

import com.ardesk.collections.engine.RiskBand;
import com.ardesk.collections.model.CustomerCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class RiskForecast {
    Long customerId;
    String customerName;
    CustomerCategory category;

    int stuckProbability; // 0..100
    RiskBand riskBand;
    LocalDate expectedPaymentDate;

    BigDecimal onTimeRate; // percent, null when no invoice is fully paid
    BigDecimal avgDelayDays;
    int unpaidInvoices;
    BigDecimal unpaidAmount;
}
