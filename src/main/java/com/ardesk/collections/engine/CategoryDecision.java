package com.ardesk.collections.engine;

import com.ardesk.collections.model.CustomerCategory;
import lombok.Value;

@Value
public class CategoryDecision {

    public enum Outcome {
        REASSIGNED,
        UNCHANGED,
        SKIPPED_OVERRIDE
    }

    Long customerId;
    Outcome outcome;
    CustomerCategory currentCategory;
    CustomerCategory targetCategory; // equals currentCategory unless reassigned
    Integer matchedRulePriority; // null when no rule matched
}
