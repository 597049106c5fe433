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
public class SystemStatus {

    private String status; // healthy / unhealthy
    private String version;
    private DataLoadStatus dataSources;
    private CrowdTotals crowdValidations;
    private Map<String, String> systemHealth;
    private String lastUpdated;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CrowdTotals {
        private int totalTrains;
        private int totalConfirmations;
        private int activeConfirmations;
    }
}
