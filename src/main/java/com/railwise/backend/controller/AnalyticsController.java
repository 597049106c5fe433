package com.railwise.backend.controller;

import com.railwise.backend.model.DelayAnalyticsResponse;
import com.railwise.backend.model.DelayPrediction;
import com.railwise.backend.model.DelayStatistics;
import com.railwise.backend.model.RouteSimulation;
import com.railwise.backend.repository.ScheduleStore;
import com.railwise.backend.service.DelaySimulationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics", description = "Simulated delay statistics and predictions")
public class AnalyticsController {

    private static final String NO_DATA = "No delay data available";

    private final DelaySimulationService delaySimulationService;
    private final ScheduleStore scheduleStore;
    private final Clock clock;

    @Operation(summary = "Delay Statistics", description = "Statistics of the recorded delays for a train (optionally at one station), or an overview over all trains.")
    @GetMapping("/delays")
    public DelayAnalyticsResponse getDelays(
            @Parameter(description = "Train number") @RequestParam(required = false) String train,
            @Parameter(description = "Station name") @RequestParam(required = false) String station) {
        String timestamp = Instant.now(clock).toString();

        if (train == null || train.isBlank()) {
            return DelayAnalyticsResponse.builder()
                    .analyticsType("overall_delays")
                    .overall(delaySimulationService.getOverallStats(scheduleStore.getAllTrainNumbers()))
                    .timestamp(timestamp)
                    .build();
        }

        Optional<DelayStatistics> stats = delaySimulationService.getHistoricalStats(train, station);
        return DelayAnalyticsResponse.builder()
                .analyticsType(station != null ? "train_station_delays" : "train_delays")
                .trainNumber(train)
                .stationName(station)
                .stats(stats.orElse(null))
                .message(stats.isPresent() ? null : NO_DATA)
                .timestamp(timestamp)
                .build();
    }

    @Operation(summary = "Delay Probability", description = "Probability that a train is delayed at a station, from its recorded history.")
    @GetMapping("/delays/prediction")
    public DelayPrediction predict(
            @Parameter(description = "Train number", required = true) @RequestParam String train,
            @Parameter(description = "Station name", required = true) @RequestParam String station,
            @Parameter(description = "Scheduled time (ISO local date-time), defaults to now") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime time) {
        LocalDateTime scheduledTime = time != null ? time : LocalDateTime.now(clock);
        return delaySimulationService.predictDelayProbability(train, station, scheduledTime);
    }

    @Operation(summary = "Route Simulation", description = "Simulates delays along the whole route, carrying each delay to the next stop.")
    @ApiResponse(responseCode = "404", description = "Unknown train", content = @Content)
    @GetMapping("/simulation/{trainNumber}")
    public RouteSimulation simulate(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber,
            @Parameter(description = "Start time (ISO local date-time), defaults to now") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start) {
        LocalDateTime startTime = start != null ? start : LocalDateTime.now(clock);
        return delaySimulationService.simulateRouteDelays(trainNumber, startTime);
    }
}
