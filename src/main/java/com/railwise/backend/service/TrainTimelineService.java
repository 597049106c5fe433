package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.*;
import com.railwise.backend.repository.ScheduleStore;
import com.railwise.backend.util.RailwayUtils;
import com.railwise.backend.util.ScheduleTimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembles the per-station timeline of a train: status tags, simulated
 * delays, distances and crowd estimates, plus the position summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainTimelineService {

    static final String UNKNOWN = "Unknown";

    private final ScheduleStore scheduleStore;
    private final PositionService positionService;
    private final DelaySimulationService delaySimulationService;
    private final CrowdValidationService crowdValidationService;
    private final Clock clock;

    /**
     * Timeline with crowd confirmations applied, as served to clients.
     */
    public TrainStatusReport getTrainStatus(String trainNumber) {
        TrainStatusReport report = generateStatus(trainNumber);
        return crowdValidationService.adjustWithCrowdData(trainNumber, report);
    }

    public TrainStatusReport generateStatus(String trainNumber) {
        TrainSchedule schedule = scheduleStore.getSchedule(trainNumber)
                .orElseThrow(() -> new TrainNotFoundException(trainNumber));

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        List<Stop> stops = schedule.getRoutes();

        int position = positionService.currentStopIndex(stops, now.toLocalTime());
        PositionSnapshot snapshot = positionService.snapshot(schedule, position, now);

        List<String> cities = stops.stream().map(Stop::getCity).collect(Collectors.toList());
        List<StationStatus> statuses = new ArrayList<>();
        int maxDelay = 0;

        for (int i = 0; i < stops.size(); i++) {
            Stop stop = stops.get(i);
            try {
                StationStatus status = buildStationStatus(trainNumber, stop, StationStatusType.of(i, position),
                        positionService.routeDistance(cities.subList(0, i + 1)), today, now);
                maxDelay = Math.max(maxDelay, status.getDelayMinutes());
                statuses.add(status);
            } catch (RuntimeException e) {
                log.warn("⚠️ Skipping stop {} of train {}: {}", i, trainNumber, e.getMessage());
            }
        }

        String currentStation = snapshot.isAvailable() ? snapshot.getCurrentStation() : UNKNOWN;
        WeatherCondition weather = delaySimulationService.getWeatherCondition(currentStation);
        double speed = snapshot.isAvailable() ? positionService.estimateSpeed(now.toLocalTime()) : 0.0;

        TrainStatusReport report = TrainStatusReport.builder()
                .trainNumber(trainNumber)
                .trainName(schedule.getTrainName())
                .stationStatuses(statuses)
                .currentSpeed(speed)
                .distanceCovered(snapshot.isAvailable() ? snapshot.getDistanceCovered() : 0.0)
                .distanceToNext(snapshot.isAvailable() ? snapshot.getDistanceToNext() : 0.0)
                .delayMinutes(maxDelay)
                .estimatedArrival(snapshot.isAvailable() ? snapshot.getEtaToNext() : UNKNOWN)
                .progressPercentage(snapshot.isAvailable() ? snapshot.getProgressPercentage() : 0.0)
                .currentStation(currentStation)
                .nextStation(snapshot.isAvailable() ? snapshot.getNextStation() : UNKNOWN)
                .weatherCondition(weather)
                .lastUpdated(now)
                .build();

        log.info("🚆 Train {} at {} ({}% of route, {} min delay)", trainNumber, currentStation,
                report.getProgressPercentage(), maxDelay);
        return report;
    }

    private StationStatus buildStationStatus(String trainNumber, Stop stop, StationStatusType type,
            double distanceFromStart, LocalDate today, LocalDateTime now) {
        String city = stop.getCity();
        WeatherCondition weather = delaySimulationService.getWeatherCondition(city);

        Optional<LocalDateTime> scheduledArrival = ScheduleTimeUtils.parseOn(stop.getArrivalTime(), today);
        Optional<LocalDateTime> scheduledDeparture = ScheduleTimeUtils.parseOn(stop.getDepartureTime(), today);

        int arrivalDelay = scheduledArrival
                .map(t -> delaySimulationService.synthesizeDelay(trainNumber, city, t, now, weather).getDelayMinutes())
                .orElse(0);
        int departureDelay = scheduledDeparture
                .map(t -> delaySimulationService.synthesizeDelay(trainNumber, city, t, now, weather).getDelayMinutes())
                .orElse(0);

        return StationStatus.builder()
                .stationName(city)
                .status(type)
                .scheduledArrival(scheduledArrival.orElse(null))
                .scheduledDeparture(scheduledDeparture.orElse(null))
                .actualArrival(scheduledArrival.map(t -> t.plusMinutes(arrivalDelay)).orElse(null))
                .actualDeparture(scheduledDeparture.map(t -> t.plusMinutes(departureDelay)).orElse(null))
                .delayMinutes(Math.max(arrivalDelay, departureDelay))
                .haltDuration(stop.getHalt())
                .duration(stop.getDuration())
                .distanceFromStart(distanceFromStart)
                .weatherCondition(weather)
                .crowdLevel(estimateCrowdLevel(city, stop.getArrivalTime()))
                .build();
    }

    /**
     * Schedule-based crowd guess from the arrival hour and whether the stop
     * is a major hub.
     */
    static CrowdLevel estimateCrowdLevel(String stationName, String arrivalClock) {
        Optional<LocalTime> arrival = ScheduleTimeUtils.parse(arrivalClock);
        if (arrival.isEmpty()) {
            return CrowdLevel.NORMAL;
        }
        int hour = arrival.get().getHour();
        boolean hub = RailwayUtils.isMajorStation(stationName);

        if ((hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19)) {
            return hub ? CrowdLevel.HIGH : CrowdLevel.MEDIUM;
        } else if (hour >= 22 || hour <= 5) {
            return CrowdLevel.LOW;
        }
        return hub ? CrowdLevel.MEDIUM : CrowdLevel.NORMAL;
    }
}
