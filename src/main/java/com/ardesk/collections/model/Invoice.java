package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "invoices")
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String invoiceNumber;

    @Column(nullable = false)
    private Long customerId;

    private LocalDate invoiceDate;

    @Column(precision = 14, scale = 2)
    private BigDecimal amount;

    // Overrides the customer's default terms when set
    private Integer paymentTermsDays;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
