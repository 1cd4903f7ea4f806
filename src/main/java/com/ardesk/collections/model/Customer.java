package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "customers")
@Data
public class Customer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    private String salesPerson;
    private String mobile;
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CustomerCategory category = CustomerCategory.ALPHA;

    // Set by a person; automatic recalculation must leave the category alone
    private boolean categoryManualOverride = false;

    @Column(precision = 14, scale = 2)
    private BigDecimal creditLimit;

    @Column(precision = 14, scale = 2)
    private BigDecimal openingBalance = BigDecimal.ZERO;

    private int paymentTermsDays = 0;
}
