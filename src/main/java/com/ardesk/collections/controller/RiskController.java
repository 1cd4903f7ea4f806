package com.ardesk.collections.controller;

import com.ardesk.collections.dto.ForecastReport;
import com.ardesk.collections.service.RiskForecastService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/risk")
public class RiskController {

    private final RiskForecastService riskForecastService;

    public RiskController(RiskForecastService riskForecastService) {
        this.riskForecastService = riskForecastService;
    }

    @GetMapping("/payment-forecaster")
    public ForecastReport paymentForecaster(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId) {
        return riskForecastService.forecast(TenantHeaders.require(tenantId));
    }
}
