package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainCrowdData {
    private String trainNumber;
    private int totalConfirmations;
    private int activeConfirmations;
    private CrowdLevel crowdLevel;
    private String lastUpdated;

    // Active confirmations only
    @Builder.Default
    private List<CrowdConfirmation> confirmations = new ArrayList<>();
}
