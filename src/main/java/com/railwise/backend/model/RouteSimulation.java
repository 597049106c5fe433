package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteSimulation {
    private String trainNumber;
    private String trainName;
    private LocalDateTime startTime;
    private List<SimulatedStop> stops;
}
