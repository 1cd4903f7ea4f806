package com.ardesk.collections.service;

import com.ardesk.collections.config.CollectionsProperties;
import com.ardesk.collections.engine.RiskWeights;
import com.ardesk.collections.event.LedgerMutation;
import com.ardesk.collections.event.ReadModelsInvalidatedEvent;
import com.ardesk.collections.model.TenantSetting;
import com.ardesk.collections.repository.TenantSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Tenant-scoped overrides of the engine defaults, stored as key/value rows.
 */
@Slf4j
@Service
public class TenantSettingsService {

    public static final String KEY_GRACE_DAYS = "grace_days";
    public static final String KEY_LATE_PAYMENT_WEIGHT = "risk.late_payment_weight";
    public static final String KEY_DELAY_WEIGHT = "risk.delay_weight";
    public static final String KEY_VOLUME_WEIGHT = "risk.volume_weight";
    public static final String KEY_AMOUNT_WEIGHT = "risk.amount_weight";

    private static final List<String> RISK_KEYS = List.of(KEY_LATE_PAYMENT_WEIGHT, KEY_DELAY_WEIGHT,
            KEY_VOLUME_WEIGHT, KEY_AMOUNT_WEIGHT);

    private final TenantSettingRepository tenantSettingRepository;
    private final CollectionsProperties properties;
    private final RiskWeights defaultRiskWeights;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    public TenantSettingsService(TenantSettingRepository tenantSettingRepository,
            CollectionsProperties properties,
            RiskWeights defaultRiskWeights,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher) {
        this.tenantSettingRepository = tenantSettingRepository;
        this.properties = properties;
        this.defaultRiskWeights = defaultRiskWeights;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    public int getGraceDays(String tenantId) {
        return tenantSettingRepository.findByTenantIdAndSettingKey(tenantId, KEY_GRACE_DAYS)
                .map(TenantSetting::getSettingValue)
                .map(val -> {
                    try {
                        return val.isBlank() ? properties.getGraceDays() : Integer.parseInt(val.trim());
                    } catch (NumberFormatException e) {
                        log.warn("Tenant {}: invalid {} '{}', using default", tenantId, KEY_GRACE_DAYS, val);
                        return properties.getGraceDays();
                    }
                })
                .orElse(properties.getGraceDays());
    }

    /**
     * The tenant's weights, or the configured defaults when the tenant's overrides are incomplete
     * or do not sum to 1.
     */
    public RiskWeights getRiskWeights(String tenantId) {
        Map<String, String> stored = stored(tenantId);
        if (!stored.containsKey(KEY_LATE_PAYMENT_WEIGHT) && !stored.containsKey(KEY_DELAY_WEIGHT)
                && !stored.containsKey(KEY_VOLUME_WEIGHT) && !stored.containsKey(KEY_AMOUNT_WEIGHT)) {
            return defaultRiskWeights;
        }
        try {
            return riskWeights(stored);
        } catch (IllegalArgumentException e) {
            log.warn("Tenant {}: risk weight overrides rejected ({}); using defaults", tenantId, e.getMessage());
            return defaultRiskWeights;
        }
    }

    /**
     * Effective value of every known key.
     */
    public Map<String, String> getSettings(String tenantId) {
        RiskWeights weights = getRiskWeights(tenantId);
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put(KEY_GRACE_DAYS, String.valueOf(getGraceDays(tenantId)));
        settings.put(KEY_LATE_PAYMENT_WEIGHT, weights.getLatePaymentWeight().toPlainString());
        settings.put(KEY_DELAY_WEIGHT, weights.getDelayWeight().toPlainString());
        settings.put(KEY_VOLUME_WEIGHT, weights.getVolumeWeight().toPlainString());
        settings.put(KEY_AMOUNT_WEIGHT, weights.getAmountWeight().toPlainString());
        return settings;
    }

    public void updateSetting(String tenantId, String key, String value) {
        if (RISK_KEYS.contains(key)) {
            updateRiskWeights(tenantId, Collections.singletonMap(key, value));
            return;
        }
        if (!KEY_GRACE_DAYS.equals(key)) {
            throw new IllegalArgumentException("Unknown setting: " + key);
        }
        String normalized = validate(key, value);
        save(tenantId, key, normalized);

        auditService.log(tenantId, AuditService.SETTING_UPDATED, key + " = " + normalized);
        eventPublisher.publishEvent(ReadModelsInvalidatedEvent.of(tenantId, LedgerMutation.TENANT_SETTING_CHANGED));
    }

    /**
     * Changes any of the four risk weights in one step. The resulting set, with defaults for weights the
     * tenant never set, must still sum to 1; otherwise nothing is written.
     */
    public void updateRiskWeights(String tenantId, Map<String, String> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("No risk weights given");
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : weights.entrySet()) {
            if (!RISK_KEYS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Unknown risk weight: " + entry.getKey());
            }
            normalized.put(entry.getKey(), validate(entry.getKey(), entry.getValue()));
        }

        Map<String, String> merged = stored(tenantId);
        merged.putAll(normalized);
        riskWeights(merged);

        normalized.forEach((key, value) -> save(tenantId, key, value));
        StringJoiner details = new StringJoiner(", ");
        normalized.forEach((key, value) -> details.add(key + " = " + value));
        auditService.log(tenantId, AuditService.SETTING_UPDATED, details.toString());
        eventPublisher.publishEvent(ReadModelsInvalidatedEvent.of(tenantId, LedgerMutation.TENANT_SETTING_CHANGED));
    }

    private void save(String tenantId, String key, String value) {
        Optional<TenantSetting> existing = tenantSettingRepository.findByTenantIdAndSettingKey(tenantId, key);
        if (existing.isPresent()) {
            TenantSetting setting = existing.get();
            setting.setSettingValue(value);
            tenantSettingRepository.save(setting);
        } else {
            tenantSettingRepository.save(new TenantSetting(tenantId, key, value));
        }
    }

    // Throws IllegalArgumentException when the merged weights are not a usable set
    private RiskWeights riskWeights(Map<String, String> stored) {
        return new RiskWeights(
                weight(stored, KEY_LATE_PAYMENT_WEIGHT, defaultRiskWeights.getLatePaymentWeight()),
                weight(stored, KEY_DELAY_WEIGHT, defaultRiskWeights.getDelayWeight()),
                weight(stored, KEY_VOLUME_WEIGHT, defaultRiskWeights.getVolumeWeight()),
                weight(stored, KEY_AMOUNT_WEIGHT, defaultRiskWeights.getAmountWeight()),
                defaultRiskWeights.getDelaySaturationDays(),
                defaultRiskWeights.getVolumeSaturationInvoices())
                .validated();
    }

    private static String validate(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Value for " + key + " must not be blank");
        }
        String trimmed = value.trim();
        try {
            if (KEY_GRACE_DAYS.equals(key)) {
                if (Integer.parseInt(trimmed) < 0) {
                    throw new IllegalArgumentException(key + " must not be negative");
                }
            } else if (new BigDecimal(trimmed).signum() < 0) {
                throw new IllegalArgumentException(key + " must not be negative");
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value for " + key + " is not a number: " + trimmed);
        }
        return trimmed;
    }

    private Map<String, String> stored(String tenantId) {
        Map<String, String> values = new HashMap<>();
        for (TenantSetting setting : tenantSettingRepository.findByTenantId(tenantId)) {
            values.put(setting.getSettingKey(), setting.getSettingValue());
        }
        return values;
    }

    private static BigDecimal weight(Map<String, String> stored, String key, BigDecimal fallback) {
        String value = stored.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value);
        }
    }
}
