package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainSearchResponse {
    private String searchType; // train_number or station_to_station
    private String query;
    private String fromStation;
    private String toStation;

    @Builder.Default
    private List<TrainSchedule> results = new ArrayList<>();

    private int totalCount;
    private String message;
}
