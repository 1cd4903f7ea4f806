package com.ardesk.collections.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier of a customer, best (Alpha) to worst (Delta).
 */
public enum CustomerCategory {
    ALPHA("Alpha"),
    BETA("Beta"),
    GAMMA("Gamma"),
    DELTA("Delta");

    private final String label;

    CustomerCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the label ("Beta") or the constant name ("BETA").
     */
    public static CustomerCategory fromLabel(String value) {
        for (CustomerCategory category : values()) {
            if (category.label.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
