package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DelayStatistics {
    private int totalDelays;
    private double averageDelay;
    private int maxDelay;
    private int minDelay;
    // "0-15 min", "16-30 min", "31-60 min", "60+ min" in that order
    private Map<String, Integer> delayDistribution;
}
