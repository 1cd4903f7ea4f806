package com.ardesk.collections.config;

import com.ardesk.collections.engine.RiskWeights;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(CollectionsProperties.class)
public class EngineConfiguration {

    @Bean
    public Clock clock(CollectionsProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    /**
     * Shared pool for per-customer computation. Sized to the machine; fairness between tenants is
     * enforced by the dispatcher, not here.
     */
    @Bean(name = "engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor(CollectionsProperties properties) {
        int poolSize = Math.max(1, properties.getEngine().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("engine-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    // Fails startup when the configured weights cannot produce a 0..100 score
    @Bean
    public RiskWeights defaultRiskWeights(CollectionsProperties properties) {
        CollectionsProperties.Risk risk = properties.getRisk();
        return new RiskWeights(risk.getLatePaymentWeight(), risk.getDelayWeight(), risk.getVolumeWeight(),
                risk.getAmountWeight(), risk.getDelaySaturationDays(), risk.getVolumeSaturationInvoices())
                .validated();
    }
}
