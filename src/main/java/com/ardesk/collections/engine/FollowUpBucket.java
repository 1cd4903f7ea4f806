package com.ardesk.collections.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a customer's next scheduled follow-up falls relative to today. Exactly one applies.
 */
public enum FollowUpBucket {
    OVERDUE("overdue"),
    DUE_TODAY("dueToday"),
    DUE_TOMORROW("dueTomorrow"),
    DUE_THIS_WEEK("dueThisWeek"),
    DUE_THIS_MONTH("dueThisMonth"),
    NO_FOLLOW_UP("noFollowUp"),
    // Beyond the current month; no dashboard card shows it yet
    UNSCHEDULED_FUTURE("unscheduledFuture");

    private final String key;

    FollowUpBucket(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static FollowUpBucket fromKey(String key) {
        for (FollowUpBucket bucket : values()) {
            if (bucket.key.equalsIgnoreCase(key) || bucket.name().equalsIgnoreCase(key)) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Unknown follow-up bucket: " + key);
    }
}
