package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.Stop;
import com.railwise.backend.model.TrainSchedule;
import com.railwise.backend.model.TrainSearchResponse;
import com.railwise.backend.model.TrainSummary;
import com.railwise.backend.repository.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrainService {

    private final ScheduleStore scheduleStore;
    private final PositionService positionService;
    private final CrowdValidationService crowdValidationService;

    /**
     * Searches by train number/name when {@code number} is given, otherwise by
     * station pair.
     */
    public TrainSearchResponse search(String number, String from, String to) {
        if (number != null && !number.isBlank()) {
            List<TrainSchedule> results = scheduleStore.findByNumberOrName(number.trim());
            log.info("🔍 Search for train '{}' matched {} train(s)", number, results.size());
            return TrainSearchResponse.builder()
                    .searchType("train_number")
                    .query(number)
                    .results(results)
                    .totalCount(results.size())
                    .message(results.isEmpty() ? "No trains found matching " + number : null)
                    .build();
        }

        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            log.warn("⚠️ Search rejected: no train number and incomplete station pair");
            throw new IllegalArgumentException("Provide either 'number' or both 'from' and 'to'");
        }

        List<TrainSchedule> results = scheduleStore.findByStations(from.trim(), to.trim());
        log.info("🔍 Search {} -> {} matched {} train(s)", from, to, results.size());
        return TrainSearchResponse.builder()
                .searchType("station_to_station")
                .fromStation(from)
                .toStation(to)
                .results(results)
                .totalCount(results.size())
                .message(results.isEmpty() ? "No trains found from " + from + " to " + to : null)
                .build();
    }

    public TrainSchedule requireSchedule(String trainNumber) {
        return scheduleStore.getSchedule(trainNumber)
                .orElseThrow(() -> new TrainNotFoundException(trainNumber));
    }

    public TrainSummary getSummary(String trainNumber) {
        TrainSchedule schedule = requireSchedule(trainNumber);
        List<Stop> stops = schedule.getRoutes();
        Stop origin = stops.get(0);
        Stop destination = stops.get(stops.size() - 1);

        double totalDistance = positionService.routeDistance(stops.stream()
                .map(Stop::getCity)
                .collect(Collectors.toList()));

        return TrainSummary.builder()
                .trainNumber(trainNumber)
                .trainName(schedule.getTrainName())
                .operatingDays(schedule.getDays())
                .totalStations(stops.size())
                .routeSummary(TrainSummary.RouteSummary.builder()
                        .origin(origin.getCity())
                        .destination(destination.getCity())
                        .totalDistance(totalDistance)
                        .build())
                .scheduleInfo(TrainSummary.ScheduleInfo.builder()
                        .departureTime(origin.getDepartureTime())
                        .arrivalTime(destination.getArrivalTime())
                        .build())
                .crowdData(crowdValidationService.getCrowdData(trainNumber))
                .build();
    }
}
