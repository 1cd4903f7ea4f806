package com.ardesk.collections.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskBand {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    static final int MEDIUM_FROM = 30;
    static final int HIGH_FROM = 70;

    private final String label;

    RiskBand(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * [0,30) Low, [30,70) Medium, [70,100] High.
     */
    public static RiskBand of(int stuckProbability) {
        if (stuckProbability >= HIGH_FROM) {
            return HIGH;
        }
        if (stuckProbability >= MEDIUM_FROM) {
            return MEDIUM;
        }
        return LOW;
    }
}
