package com.railwise.backend.service;

import ch.hsr.geohash.GeoHash;
import com.railwise.backend.model.Coordinate;
import com.railwise.backend.model.Station;
import com.railwise.backend.model.StationTrain;
import com.railwise.backend.model.Stop;
import com.railwise.backend.model.TrainSchedule;
import com.railwise.backend.repository.ScheduleStore;
import com.railwise.backend.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class StationService {

    private static final int GEOHASH_PRECISION = 9;

    private final ScheduleStore scheduleStore;

    public List<Station> getAllStations() {
        return scheduleStore.getStations().entrySet().stream()
                .map(entry -> toStation(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    /**
     * Search stations within a given radius (km) of a location.
     */
    public List<Station> searchByLocation(double lat, double lon, double radiusKm) {
        Coordinate origin = Coordinate.builder().latitude(lat).longitude(lon).build();
        List<Station> results = scheduleStore.getStations().entrySet().stream()
                .filter(entry -> GeoUtils.distanceKm(origin, entry.getValue()) <= radiusKm)
                .map(entry -> toStation(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        log.info("🔍 Found {} stations within {} km of ({}, {})", results.size(), radiusKm, lat, lon);
        return results;
    }

    /**
     * Trains calling at a station, matched case-insensitively on the stop name.
     */
    public List<StationTrain> getTrainsAtStation(String stationName) {
        List<StationTrain> trains = new ArrayList<>();
        for (TrainSchedule schedule : scheduleStore.getAllSchedules()) {
            for (Stop stop : schedule.getRoutes()) {
                if (stop.getCity() != null && stop.getCity().equalsIgnoreCase(stationName)) {
                    trains.add(StationTrain.builder()
                            .trainNumber(schedule.getTrainNumber())
                            .trainName(schedule.getTrainName())
                            .arrivalTime(stop.getArrivalTime())
                            .departureTime(stop.getDepartureTime())
                            .haltDuration(stop.getHalt())
                            .operatingDays(schedule.getDays())
                            .build());
                    break;
                }
            }
        }
        log.info("🔍 {} trains call at {}", trains.size(), stationName);
        return trains;
    }

    private static Station toStation(String name, Coordinate coordinate) {
        return Station.builder()
                .name(name)
                .lat(coordinate.getLatitude())
                .lon(coordinate.getLongitude())
                .geoHash(GeoHash.geoHashStringWithCharacterPrecision(coordinate.getLatitude(),
                        coordinate.getLongitude(), GEOHASH_PRECISION))
                .build();
    }
}
