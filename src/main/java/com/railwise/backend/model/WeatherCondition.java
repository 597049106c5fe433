package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WeatherCondition {
    CLEAR("clear", 1.0),
    CLOUDY("cloudy", 1.2),
    RAINY("rainy", 1.5),
    STORMY("stormy", 2.0),
    FOGGY("foggy", 1.8);

    private final String label;
    private final double delayFactor;

    WeatherCondition(String label, double delayFactor) {
        this.label = label;
        this.delayFactor = delayFactor;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public double getDelayFactor() {
        return delayFactor;
    }
}
