package com.railwise.backend.repository;

import com.railwise.backend.model.Coordinate;
import com.railwise.backend.model.DataLoadStatus;
import com.railwise.backend.model.Stop;
import com.railwise.backend.model.TrainSchedule;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the loaded static reference data: train schedules and
 * station coordinates. Implementations hold an immutable snapshot that is
 * swapped on {@link #reload()}.
 */
public interface ScheduleStore {

    Optional<TrainSchedule> getSchedule(String trainNumber);

    /**
     * Ordered stops of a train, empty when the train is unknown.
     */
    default Optional<List<Stop>> getRoute(String trainNumber) {
        return getSchedule(trainNumber).map(TrainSchedule::getRoutes);
    }

    Optional<Coordinate> getCoordinates(String stationName);

    Map<String, Coordinate> getStations();

    /**
     * Trains calling at both stations, {@code from} before {@code to}.
     */
    List<TrainSchedule> findByStations(String from, String to);

    /**
     * Case-insensitive substring match against the train number or name.
     */
    List<TrainSchedule> findByNumberOrName(String query);

    List<TrainSchedule> getAllSchedules();

    List<String> getAllTrainNumbers();

    DataLoadStatus getStatus();

    DataLoadStatus reload();
}
