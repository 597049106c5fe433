package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainStatusReport {
    private String trainNumber;
    private String trainName;

    @Builder.Default
    private List<StationStatus> stationStatuses = new ArrayList<>();

    private double currentSpeed;
    private double distanceCovered;
    private double distanceToNext;
    // Worst station delay, not a sum
    private int delayMinutes;
    private String estimatedArrival;
    private double progressPercentage;
    private String currentStation;
    private String nextStation;
    private WeatherCondition weatherCondition;
    private LocalDateTime lastUpdated;

    // Set only by the crowd adjustment
    private CrowdValidationInfo crowdValidation;
    private Boolean etaAdjustedByCrowd;
    private Confidence crowdEtaConfidence;
}
