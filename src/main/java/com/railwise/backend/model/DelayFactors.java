package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Multipliers applied to a synthetic delay. Predictions only carry the
 * time-of-day and day-of-week factors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DelayFactors {
    private Double weather;
    private Double timeOfDay;
    private Double dayOfWeek;
    private Double station;
}
