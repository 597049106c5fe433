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
public class TrainSummary {

    private String trainNumber;
    private String trainName;

    @Builder.Default
    private List<String> operatingDays = new ArrayList<>();

    private int totalStations;
    private RouteSummary routeSummary;
    private ScheduleInfo scheduleInfo;
    private TrainCrowdData crowdData;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RouteSummary {
        private String origin;
        private String destination;
        private double totalDistance;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduleInfo {
        // Raw clock strings as published
        private String departureTime;
        private String arrivalTime;
    }
}
