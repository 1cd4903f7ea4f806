package com.ardesk.collections.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "follow_ups")
@Data
public class FollowUp {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private LocalDateTime followUpDateTime; // when the contact happened

    private LocalDateTime nextFollowUpDate; // when to call again, may be empty

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FollowUpStatus status = FollowUpStatus.PENDING;

    private String type; // "Call", "Email", "Visit"...

    @Column(length = 1000)
    private String remarks;
}
