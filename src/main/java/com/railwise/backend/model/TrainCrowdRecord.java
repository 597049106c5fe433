package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted crowd confirmations of one train, one document per train.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainCrowdRecord {
    private String trainNumber;

    @Builder.Default
    private List<CrowdConfirmation> confirmations = new ArrayList<>();

    private int totalConfirmations;
    private String lastUpdated;
}
