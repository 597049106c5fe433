package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DelayPrediction {

    public static final double FALLBACK_PROBABILITY = 0.3;

    private double delayProbability;
    private Confidence confidence;
    private int historicalDataPoints;
    private DelayFactors factorsApplied;

    public static DelayPrediction fallback() {
        return DelayPrediction.builder()
                .delayProbability(FALLBACK_PROBABILITY)
                .confidence(Confidence.LOW)
                .historicalDataPoints(0)
                .build();
    }
}
