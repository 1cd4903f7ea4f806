package com.ardesk.collections.dto;

import lombok.Value;

import java.util.List;

@Value
public class ForecastReport {
    List<RiskForecast> forecasts;
    ForecastSummary summary;
    List<SkippedCustomer> skipped;
}
