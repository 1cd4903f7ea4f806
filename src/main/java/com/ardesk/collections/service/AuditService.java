package com.ardesk.collections.service;

import com.ardesk.collections.model.AuditLog;
import com.ardesk.collections.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AuditService {

    public static final String CATEGORY_REASSIGNED = "CATEGORY_REASSIGNED";
    public static final String SETTING_UPDATED = "SETTING_UPDATED";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(String tenantId, String action, String details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setTenantId(tenantId);
            entry.setAction(action);
            entry.setDetails(details);

            var auth = SecurityContextHolder.getContext().getAuthentication();
            entry.setUsername(auth != null ? auth.getName() : "SYSTEM");

            auditLogRepository.save(entry);
        } catch (Exception e) {
            // Audit trail must not break the operation being audited
            log.error("Failed to write audit log for tenant {} ({}): {}", tenantId, action, e.getMessage(), e);
        }
    }
}
