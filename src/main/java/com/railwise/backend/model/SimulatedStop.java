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
public class SimulatedStop {
    private Stop stop;
    // Absent when the stop has no usable departure time
    private DelayResult simulatedDelay;
    private WeatherCondition weatherCondition;
}
