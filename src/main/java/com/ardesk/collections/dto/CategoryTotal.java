package com.ardesk.collections.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CategoryTotal {
    long count;
    BigDecimal totalBalance;
}
