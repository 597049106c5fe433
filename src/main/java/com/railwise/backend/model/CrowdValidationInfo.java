package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrowdValidationInfo {
    private Confidence confidence;
    private int activeUsers;
    private CrowdLevel crowdLevel;
    private String lastUpdated;
}
