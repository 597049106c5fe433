package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.Coordinate;
import com.railwise.backend.model.PositionSnapshot;
import com.railwise.backend.model.Stop;
import com.railwise.backend.model.TrainSchedule;
import com.railwise.backend.repository.ScheduleStore;
import com.railwise.backend.util.GeoUtils;
import com.railwise.backend.util.RailwayUtils;
import com.railwise.backend.util.ScheduleTimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Infers where a train is from its published timetable alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionService {

    public static final double BASE_SPEED_KMH = 60.0;

    private final ScheduleStore scheduleStore;
    private final RandomSource random;
    private final Clock clock;

    /**
     * Index of the stop the train is at or has most recently left: one before
     * the first stop whose boundary time is strictly after {@code now}, or the
     * last stop when every boundary has passed. A stop's boundary is its
     * departure; the terminal stop, which has none, uses its arrival.
     * Stops without a parseable boundary are skipped.
     */
    public int currentStopIndex(List<Stop> route, LocalTime now) {
        int last = route.size() - 1;
        for (int i = 0; i < route.size(); i++) {
            Optional<LocalTime> boundary = boundaryTime(route.get(i), i == last);
            if (boundary.isPresent() && boundary.get().isAfter(now)) {
                return Math.max(i - 1, 0);
            }
        }
        return Math.max(last, 0);
    }

    public PositionSnapshot positionSnapshot(String trainNumber) {
        return positionSnapshot(trainNumber, LocalDateTime.now(clock));
    }

    public PositionSnapshot positionSnapshot(String trainNumber, LocalDateTime now) {
        TrainSchedule schedule = scheduleStore.getSchedule(trainNumber)
                .orElseThrow(() -> new TrainNotFoundException(trainNumber));
        int index = currentStopIndex(schedule.getRoutes(), now.toLocalTime());
        return snapshot(schedule, index, now);
    }

    /**
     * Builds the snapshot for an already computed stop index, so callers that
     * also tag stops work from the same position.
     */
    public PositionSnapshot snapshot(TrainSchedule schedule, int index, LocalDateTime now) {
        List<Stop> stops = schedule.getRoutes();
        if (!hasAnyClockTime(stops)) {
            log.warn("⚠️ Train {} has no parseable times, position unavailable", schedule.getTrainNumber());
            return PositionSnapshot.unavailable(schedule.getTrainNumber(),
                    "No parseable schedule times for this train", now);
        }

        int total = stops.size();
        Stop current = stops.get(index);
        Stop next = index + 1 < total ? stops.get(index + 1) : null;

        double progress = total == 1 ? 100.0 : RailwayUtils.round((double) index / (total - 1) * 100, 1);
        List<String> covered = stops.subList(0, index + 1).stream()
                .map(Stop::getCity)
                .collect(Collectors.toList());
        double distanceToNext = next != null ? distanceBetweenStations(current.getCity(), next.getCity()) : 0.0;

        return PositionSnapshot.builder()
                .trainNumber(schedule.getTrainNumber())
                .available(true)
                .currentStationIdx(index)
                .currentStation(current.getCity())
                .nextStation(next != null ? next.getCity() : null)
                .progressPercentage(progress)
                .distanceCovered(routeDistance(covered))
                .distanceToNext(distanceToNext)
                .etaToNext(next != null ? formatEta(next.getArrivalTime(), now) : null)
                .totalStations(total)
                .currentTime(now)
                .build();
    }

    public double estimateSpeed(String trainNumber, LocalDateTime now) {
        PositionSnapshot snapshot = positionSnapshot(trainNumber, now);
        return snapshot.isAvailable() ? estimateSpeed(now.toLocalTime()) : 0.0;
    }

    /**
     * Illustrative speed for the hour of day, with a little jitter.
     */
    public double estimateSpeed(LocalTime now) {
        int hour = now.getHour();
        double factor;
        if ((hour >= 6 && hour <= 9) || (hour >= 17 && hour <= 20)) {
            factor = 0.8;
        } else if (hour >= 22 || hour <= 5) {
            factor = 1.2;
        } else {
            factor = 1.0;
        }
        return RailwayUtils.round(BASE_SPEED_KMH * factor * random.uniform(0.9, 1.1), 1);
    }

    public double distanceBetweenStations(String from, String to) {
        return routeDistance(List.of(from, to));
    }

    /**
     * Along-track distance through the named stations. Any leg touching a
     * station without coordinates counts as 0 km.
     */
    public double routeDistance(List<String> stations) {
        double total = 0.0;
        List<Coordinate> run = new ArrayList<>();
        for (String station : stations) {
            Optional<Coordinate> point = scheduleStore.getCoordinates(station);
            if (point.isPresent()) {
                run.add(point.get());
                continue;
            }
            log.warn("⚠️ Missing coordinates for {}, counting its legs as 0 km", station);
            total += GeoUtils.routeDistanceKm(run);
            run.clear();
        }
        total += GeoUtils.routeDistanceKm(run);
        return RailwayUtils.round(total, 2);
    }

    static String formatEta(String arrivalClock, LocalDateTime now) {
        Optional<LocalDateTime> arrival = ScheduleTimeUtils.parseOn(arrivalClock, now.toLocalDate());
        if (arrival.isEmpty()) {
            return null;
        }
        Duration remaining = Duration.between(now, arrival.get());
        if (remaining.isNegative() || remaining.isZero()) {
            return "Arrived";
        }
        long minutes = remaining.toMinutes();
        long hours = minutes / 60;
        return hours > 0 ? hours + "h " + (minutes % 60) + "m" : minutes + "m";
    }

    private static Optional<LocalTime> boundaryTime(Stop stop, boolean terminal) {
        Optional<LocalTime> departure = ScheduleTimeUtils.parse(stop.getDepartureTime());
        if (departure.isPresent() || !terminal) {
            return departure;
        }
        return ScheduleTimeUtils.parse(stop.getArrivalTime());
    }

    private static boolean hasAnyClockTime(List<Stop> stops) {
        return stops.stream().anyMatch(stop -> ScheduleTimeUtils.parse(stop.getArrivalTime()).isPresent()
                || ScheduleTimeUtils.parse(stop.getDepartureTime()).isPresent());
    }
}
