package com.railwise.backend.controller;

import com.railwise.backend.model.*;
import com.railwise.backend.service.CrowdValidationService;
import com.railwise.backend.service.PositionService;
import com.railwise.backend.service.TrainService;
import com.railwise.backend.service.TrainTimelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/trains")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Trains", description = "Train search, live status and crowd confirmations")
public class TrainController {

    private final TrainService trainService;
    private final TrainTimelineService trainTimelineService;
    private final PositionService positionService;
    private final CrowdValidationService crowdValidationService;

    @Operation(summary = "Search Trains", description = "Search trains by number or name, or by origin and destination station.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Search completed", content = @Content(mediaType = "application/json", schema = @Schema(implementation = TrainSearchResponse.class))),
            @ApiResponse(responseCode = "400", description = "Neither number nor from/to given", content = @Content)
    })
    @GetMapping("/search")
    public TrainSearchResponse search(
            @Parameter(description = "Train number or part of the name", example = "701") @RequestParam(required = false) String number,
            @Parameter(description = "Origin station", example = "Chattogram") @RequestParam(required = false) String from,
            @Parameter(description = "Destination station", example = "Dhaka") @RequestParam(required = false) String to) {
        return trainService.search(number, from, to);
    }

    @Operation(summary = "Train Status", description = "Per-station timeline with simulated delays, position summary and crowd adjustment.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status generated", content = @Content(mediaType = "application/json", schema = @Schema(implementation = TrainStatusReport.class))),
            @ApiResponse(responseCode = "404", description = "Unknown train", content = @Content)
    })
    @GetMapping("/{trainNumber}/status")
    public TrainStatusReport getStatus(
            @Parameter(description = "Train number", required = true, example = "701") @PathVariable String trainNumber) {
        return trainTimelineService.getTrainStatus(trainNumber);
    }

    @Operation(summary = "Train Position", description = "Schedule-derived position of the train right now.")
    @ApiResponse(responseCode = "404", description = "Unknown train", content = @Content)
    @GetMapping("/{trainNumber}/position")
    public PositionSnapshot getPosition(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber) {
        return positionService.positionSnapshot(trainNumber);
    }

    @Operation(summary = "Train Summary", description = "Origin, destination, total distance, timings and crowd data.")
    @ApiResponse(responseCode = "404", description = "Unknown train", content = @Content)
    @GetMapping("/{trainNumber}/summary")
    public TrainSummary getSummary(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber) {
        return trainService.getSummary(trainNumber);
    }

    @Operation(summary = "Confirm On Board", description = "Records that a passenger is on this train. A repeat confirmation from the same user refreshes the previous one.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Confirmation stored"),
            @ApiResponse(responseCode = "400", description = "Missing user_id", content = @Content),
            @ApiResponse(responseCode = "404", description = "Unknown train", content = @Content)
    })
    @PostMapping("/{trainNumber}/confirm")
    public ConfirmationResult confirm(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber,
            @RequestBody ConfirmationRequest request) {
        log.info("🙋 Boarding confirmation for train {} from user {}", trainNumber, request.getUserId());
        trainService.requireSchedule(trainNumber);
        return crowdValidationService.confirm(trainNumber, request.getUserId(), request.getStationName(),
                request.getCoordinates());
    }

    @Operation(summary = "Remove Confirmation", description = "Withdraws a passenger's confirmation.")
    @ApiResponse(responseCode = "404", description = "No such confirmation", content = @Content)
    @DeleteMapping("/{trainNumber}/confirm/{userId}")
    public ResponseEntity<ConfirmationResult> removeConfirmation(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber,
            @Parameter(description = "User ID", required = true) @PathVariable String userId) {
        ConfirmationResult result = crowdValidationService.removeConfirmation(trainNumber, userId);
        log.info("🧹 Removing confirmation of user {} on train {}: {}", userId, trainNumber,
                result.isSuccess() ? "removed" : "not found");
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(result);
    }

    @Operation(summary = "Crowd Data", description = "Confirmation counts and the active confirmations of a train.")
    @GetMapping("/{trainNumber}/crowd-data")
    public TrainCrowdData getCrowdData(
            @Parameter(description = "Train number", required = true) @PathVariable String trainNumber) {
        return crowdValidationService.getCrowdData(trainNumber);
    }
}
