package com.ardesk.collections.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class StatusCard {
    long count;
    BigDecimal totalAmount;
}
