package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DelayAnalyticsResponse {
    private String analyticsType; // train_station_delays, train_delays, overall_delays
    private String trainNumber;
    private String stationName;
    private DelayStatistics stats; // null when there is no history
    private OverallDelayStats overall;
    private String message;
    private String timestamp;
}
