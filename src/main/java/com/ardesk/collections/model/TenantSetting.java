package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "tenant_settings")
@Data
public class TenantSetting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String settingKey;

    @Column(nullable = false)
    private String settingValue;

    public TenantSetting() {
    }

    public TenantSetting(String tenantId, String key, String value) {
        this.tenantId = tenantId;
        this.settingKey = key;
        this.settingValue = value;
    }
}
