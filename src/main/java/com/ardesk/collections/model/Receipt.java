package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "receipts")
@Data
public class Receipt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private Long customerId;

    @Column(precision = 14, scale = 2)
    private BigDecimal amount;

    private LocalDate receiptDate;

    private String voucherType; // e.g. "Receipt", "Credit Note", "Bank"

    private Long linkedInvoiceId; // optional, pays this invoice first

    private String referenceNumber;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (voucherType == null)
            voucherType = "Receipt";
    }
}
