package com.ardesk.collections.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "collections")
public class CollectionsProperties {

    private String zone = "Asia/Kolkata";

    // Days after the due date before an open invoice counts as overdue on the status cards
    private int graceDays = 7;

    private Engine engine = new Engine();
    private Recalculation recalculation = new Recalculation();
    private Risk risk = new Risk();
    private DemoData demoData = new DemoData();

    @Data
    public static class Engine {
        private int poolSize = Runtime.getRuntime().availableProcessors();
        private int perTenantConcurrency = 4;
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Recalculation {
        private int pageSize = 200;
        private Duration pageDeadline = Duration.ofSeconds(10);
    }

    @Data
    public static class Risk {
        private BigDecimal latePaymentWeight = new BigDecimal("0.40");
        private BigDecimal delayWeight = new BigDecimal("0.30");
        private BigDecimal volumeWeight = new BigDecimal("0.15");
        private BigDecimal amountWeight = new BigDecimal("0.15");
        private int delaySaturationDays = 60;
        private int volumeSaturationInvoices = 10;
    }

    @Data
    public static class DemoData {
        private boolean enabled = false;
        private String tenantId = "demo";
    }
}
