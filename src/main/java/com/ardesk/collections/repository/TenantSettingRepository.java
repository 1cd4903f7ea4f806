package com.ardesk.collections.repository;

import com.ardesk.collections.model.TenantSetting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TenantSettingRepository extends JpaRepository<TenantSetting, Long> {
    Optional<TenantSetting> findByTenantIdAndSettingKey(String tenantId, String settingKey);

    List<TenantSetting> findByTenantId(String tenantId);
}
