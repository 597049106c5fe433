package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StationStatusType {
    COMPLETED("completed"),
    CURRENT("current"),
    NEXT("next"),
    UPCOMING("upcoming");

    private final String label;

    StationStatusType(String label) {
        this.label = label;
    }

    /**
     * Tag of the stop at {@code stationIdx} relative to the train's current stop.
     */
    public static StationStatusType of(int stationIdx, int currentPosition) {
        if (stationIdx < currentPosition) {
            return COMPLETED;
        } else if (stationIdx == currentPosition) {
            return CURRENT;
        } else if (stationIdx == currentPosition + 1) {
            return NEXT;
        }
        return UPCOMING;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
