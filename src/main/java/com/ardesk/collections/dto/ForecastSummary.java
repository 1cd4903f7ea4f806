package com.ardesk.collections.dto;

import lombok.Value;

@Value
public class ForecastSummary {
    long highRisk;
    long mediumRisk;
    long lowRisk;
}
