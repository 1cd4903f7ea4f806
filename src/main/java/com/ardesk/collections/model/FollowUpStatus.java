package com.ardesk.collections.model;

public enum FollowUpStatus {
    PENDING,
    COMPLETED,
    CANCELLED
}
