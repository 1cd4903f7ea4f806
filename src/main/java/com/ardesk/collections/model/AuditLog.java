package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String tenantId;
    private String username;
    private String action; // e.g. "CATEGORY_REASSIGNED", "SETTING_UPDATED"

    @Column(length = 1000)
    private String details; // e.g. "Customer 12: BETA -> DELTA (rule priority 1)"

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
