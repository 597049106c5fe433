package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrowdSummary {
    private int totalConfirmations;
    private int activeConfirmations;
    private CrowdLevel crowdLevel;
    private String lastUpdated;
}
