package com.railwise.backend.controller;

import com.railwise.backend.model.Station;
import com.railwise.backend.model.StationTrain;
import com.railwise.backend.service.StationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/stations")
@RequiredArgsConstructor
@Tag(name = "Stations", description = "Station data")
public class StationController {

    private final StationService stationService;

    @Operation(summary = "List Stations", description = "All known stations with coordinates and geohash.")
    @GetMapping
    public List<Station> getStations() {
        return stationService.getAllStations();
    }

    @Operation(summary = "Search Stations", description = "Stations within a radius of a location.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Stations found", content = @Content(mediaType = "application/json", schema = @Schema(implementation = Station.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameters", content = @Content)
    })
    @GetMapping("/search")
    public ResponseEntity<List<Station>> searchStations(
            @Parameter(description = "Latitude", required = true) @RequestParam Double lat,
            @Parameter(description = "Longitude", required = true) @RequestParam Double lon,
            @Parameter(description = "Radius in KM") @RequestParam(required = false, defaultValue = "10.0") Double radius) {
        if (radius <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(stationService.searchByLocation(lat, lon, radius));
    }

    @Operation(summary = "Trains At Station", description = "Trains calling at a station with their published times.")
    @GetMapping("/{stationName}/trains")
    public List<StationTrain> getTrainsAtStation(
            @Parameter(description = "Station name", required = true, example = "Dhaka") @PathVariable String stationName) {
        return stationService.getTrainsAtStation(stationName);
    }
}
