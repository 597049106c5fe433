package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TrainSchedule {

    // Schedule file name, e.g. "701"
    private String trainNumber;
    private String trainName;

    @Builder.Default
    private List<String> days = new ArrayList<>();

    // Ordered as in the source file; position is significant
    @Builder.Default
    private List<Stop> routes = new ArrayList<>();
}
