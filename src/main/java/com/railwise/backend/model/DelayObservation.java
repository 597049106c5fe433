package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DelayObservation {
    private int delayMinutes;
    private Instant timestamp;
}
