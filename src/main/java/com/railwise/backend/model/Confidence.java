package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public static Confidence fromActiveConfirmations(int activeCount) {
        if (activeCount == 0) {
            return NONE;
        } else if (activeCount <= 3) {
            return LOW;
        } else if (activeCount <= 10) {
            return MEDIUM;
        }
        return HIGH;
    }

    public static Confidence fromHistorySize(int dataPoints) {
        if (dataPoints >= 50) {
            return HIGH;
        } else if (dataPoints >= 20) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isTrusted() {
        return this == MEDIUM || this == HIGH;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
