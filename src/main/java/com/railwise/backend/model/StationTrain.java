package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A train calling at a given station, with the stop's published times.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationTrain {
    private String trainNumber;
    private String trainName;
    private String arrivalTime;
    private String departureTime;
    private String haltDuration;

    @Builder.Default
    private List<String> operatingDays = new ArrayList<>();
}
