package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrowdMetrics {
    private CrowdLevel crowdLevel;
    private Confidence confidence;
    private int activeUsers;
    private String averageTimeSinceConfirmation; // "12 minutes ago"
    private String dataFreshness; // high, medium, low
    private String lastUpdated;
}
