package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Geographic point in degrees. Stored as [longitude, latitude] in stations.json.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coordinate {
    private double longitude;
    private double latitude;
}
