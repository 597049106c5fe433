package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Crowd levels used both by the schedule-based station estimate
 * (low/normal/medium/high) and by crowd confirmations (low/medium/high/very_high).
 */
public enum CrowdLevel {
    LOW("low"),
    NORMAL("normal"),
    MEDIUM("medium"),
    HIGH("high"),
    VERY_HIGH("very_high");

    private final String label;

    CrowdLevel(String label) {
        this.label = label;
    }

    public static CrowdLevel fromActiveConfirmations(int activeCount) {
        if (activeCount == 0) {
            return LOW;
        } else if (activeCount <= 5) {
            return MEDIUM;
        } else if (activeCount <= 15) {
            return HIGH;
        }
        return VERY_HIGH;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
