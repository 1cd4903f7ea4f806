package com.ardesk.collections.dto;

import com.ardesk.collections.model.CustomerCategory;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreditUtilization {
    Long customerId;
    String customerName;
    CustomerCategory category;
    BigDecimal creditLimit;
    BigDecimal utilizedLimit;
    BigDecimal availableLimit;
    BigDecimal utilizationPercentage;
}
