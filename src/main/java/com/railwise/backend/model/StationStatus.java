package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationStatus {
    private String stationName;
    private StationStatusType status;
    private LocalDateTime scheduledArrival;
    private LocalDateTime scheduledDeparture;
    private LocalDateTime actualArrival;
    private LocalDateTime actualDeparture;
    private int delayMinutes;
    private String haltDuration;
    private String duration;
    private double distanceFromStart;
    private WeatherCondition weatherCondition;
    private CrowdLevel crowdLevel;
}
