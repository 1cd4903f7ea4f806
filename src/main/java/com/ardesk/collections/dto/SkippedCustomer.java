package com.ardesk.collections.dto;

import lombok.Value;

@Value
public class SkippedCustomer {
    Long customerId;
    String field;
    String message;
}
