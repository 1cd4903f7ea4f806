package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

/**
 * One tier rule. Rules are evaluated by ascending priority and the first match wins.
 * Null bounds are open ends; all bounds are inclusive.
 */
@Entity
@Table(name = "category_rules")
@Data
public class CategoryRule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private int priority;

    @Column(precision = 14, scale = 2)
    private BigDecimal minBalance;

    @Column(precision = 14, scale = 2)
    private BigDecimal maxBalance;

    private Integer minOverdueDays;
    private Integer maxOverdueDays;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CustomerCategory targetCategory;
}
