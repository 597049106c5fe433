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
public class DelayResult {
    private int delayMinutes;
    private LocalDateTime scheduledTime;
    private LocalDateTime actualTime;
    private WeatherCondition weatherCondition;
    private DelayFactors factorsApplied;
}
