package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Schedule-derived position of a train. When {@code available} is false only
 * the train number, the reason and the request time are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PositionSnapshot {
    private String trainNumber;
    private boolean available;
    private String reason;

    private Integer currentStationIdx;
    private String currentStation;
    private String nextStation;
    private Double progressPercentage;
    private Double distanceCovered;
    private Double distanceToNext;
    private String etaToNext; // "1h 5m", "25m", "Arrived" or null
    private Integer totalStations;
    private LocalDateTime currentTime;

    public static PositionSnapshot unavailable(String trainNumber, String reason, LocalDateTime currentTime) {
        return PositionSnapshot.builder()
                .trainNumber(trainNumber)
                .available(false)
                .reason(reason)
                .currentTime(currentTime)
                .build();
    }
}
