package com.railwise.backend.repository.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.railwise.backend.model.Coordinate;
import com.railwise.backend.model.DataLoadStatus;
import com.railwise.backend.model.Stop;
import com.railwise.backend.model.TrainSchedule;
import com.railwise.backend.repository.ScheduleStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Loads {@code schedules/*.json} and {@code stations.json} from
 * {@code railwise.data.location}. A schedule's train number is its file name.
 */
@Repository
@Slf4j
public class JsonScheduleStore implements ScheduleStore {

    private static final String SCHEDULES_PATTERN = "/schedules/*.json";
    private static final String STATIONS_FILE = "/stations.json";

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resourceResolver;

    @Value("${railwise.data.location:classpath:data}")
    private String dataLocation;

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public JsonScheduleStore(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceResolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public DataLoadStatus reload() {
        log.info("📂 Loading reference data from {}", dataLocation);
        Map<String, Coordinate> stations = loadStations();
        Resource[] scheduleFiles = findScheduleFiles();
        Map<String, TrainSchedule> schedules = loadSchedules(scheduleFiles);

        snapshot = new Snapshot(schedules, stations, Instant.now(), scheduleFiles.length - schedules.size());
        DataLoadStatus status = getStatus();
        log.info("✅ Reference data loaded: {} schedules, {} stations ({} files skipped)",
                status.getSchedulesCount(), status.getStationsCount(), status.getSkippedFiles());
        return status;
    }

    @Override
    public DataLoadStatus getStatus() {
        Snapshot current = snapshot;
        return DataLoadStatus.builder()
                .stationsCount(current.stations.size())
                .schedulesCount(current.schedules.size())
                .skippedFiles(current.skippedFiles)
                .lastLoaded(current.loadedAt != null ? current.loadedAt.toString() : null)
                .build();
    }

    @Override
    public Optional<TrainSchedule> getSchedule(String trainNumber) {
        if (trainNumber == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.schedules.get(trainNumber));
    }

    @Override
    public Optional<Coordinate> getCoordinates(String stationName) {
        if (stationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.stations.get(stationName));
    }

    @Override
    public Map<String, Coordinate> getStations() {
        return snapshot.stations;
    }

    @Override
    public List<TrainSchedule> findByStations(String from, String to) {
        List<TrainSchedule> results = snapshot.schedules.values().stream()
                .filter(schedule -> {
                    List<String> cities = schedule.getRoutes().stream()
                            .map(Stop::getCity)
                            .collect(Collectors.toList());
                    int fromIdx = cities.indexOf(from);
                    int toIdx = cities.indexOf(to);
                    return fromIdx >= 0 && toIdx >= 0 && fromIdx < toIdx;
                })
                .collect(Collectors.toList());
        log.info("🔍 Found {} trains between {} and {}", results.size(), from, to);
        return results;
    }

    @Override
    public List<TrainSchedule> findByNumberOrName(String query) {
        String needle = query.toLowerCase();
        List<TrainSchedule> results = snapshot.schedules.values().stream()
                .filter(schedule -> schedule.getTrainNumber().toLowerCase().contains(needle)
                        || (schedule.getTrainName() != null
                                && schedule.getTrainName().toLowerCase().contains(needle)))
                .collect(Collectors.toList());
        log.info("🔍 Found {} trains matching '{}'", results.size(), query);
        return results;
    }

    @Override
    public List<TrainSchedule> getAllSchedules() {
        return new ArrayList<>(snapshot.schedules.values());
    }

    @Override
    public List<String> getAllTrainNumbers() {
        return new ArrayList<>(snapshot.schedules.keySet());
    }

    private Map<String, Coordinate> loadStations() {
        Resource resource = resourceResolver.getResource(dataLocation + STATIONS_FILE);
        if (!resource.exists()) {
            log.warn("⚠️ stations.json not found under {}", dataLocation);
            return Collections.emptyMap();
        }

        Map<String, Coordinate> stations = new LinkedHashMap<>();
        try (InputStream in = resource.getInputStream()) {
            Map<String, List<Double>> raw = objectMapper.readValue(in,
                    new TypeReference<LinkedHashMap<String, List<Double>>>() {
                    });
            raw.forEach((name, lonLat) -> {
                if (lonLat == null || lonLat.size() < 2 || lonLat.get(0) == null || lonLat.get(1) == null) {
                    log.warn("⚠️ Skipping station '{}' with malformed coordinates {}", name, lonLat);
                    return;
                }
                stations.put(name, Coordinate.builder()
                        .longitude(lonLat.get(0))
                        .latitude(lonLat.get(1))
                        .build());
            });
        } catch (IOException e) {
            log.error("❌ Failed to read stations.json", e);
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(stations);
    }

    private Resource[] findScheduleFiles() {
        try {
            return resourceResolver.getResources(dataLocation + SCHEDULES_PATTERN);
        } catch (IOException e) {
            log.warn("⚠️ schedules/ directory not found under {}", dataLocation);
            return new Resource[0];
        }
    }

    private Map<String, TrainSchedule> loadSchedules(Resource[] resources) {
        Map<String, TrainSchedule> schedules = new TreeMap<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null) {
                continue;
            }
            String trainNumber = filename.substring(0, filename.length() - ".json".length());
            try (InputStream in = resource.getInputStream()) {
                JsonNode root = objectMapper.readTree(in);
                if (root == null || !root.isObject()) {
                    log.warn("⚠️ Skipping schedule {}: not a JSON object", filename);
                    continue;
                }
                JsonNode data = root.has("data") ? root.get("data") : root;
                TrainSchedule schedule = objectMapper.treeToValue(data, TrainSchedule.class);
                List<Stop> stops = schedule.getRoutes() == null ? Collections.emptyList()
                        : schedule.getRoutes().stream().filter(Objects::nonNull).collect(Collectors.toList());
                if (stops.isEmpty()) {
                    log.warn("⚠️ Skipping schedule {}: no stops", filename);
                    continue;
                }
                schedule.setTrainNumber(trainNumber);
                schedule.setRoutes(Collections.unmodifiableList(stops));
                schedules.put(trainNumber, schedule);
            } catch (IOException e) {
                log.warn("⚠️ Error loading {}: {}", filename, e.getMessage());
            }
        }
        return Collections.unmodifiableMap(schedules);
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Collections.emptyMap(), Collections.emptyMap(), null, 0);

        final Map<String, TrainSchedule> schedules;
        final Map<String, Coordinate> stations;
        final Instant loadedAt;
        final int skippedFiles;

        Snapshot(Map<String, TrainSchedule> schedules, Map<String, Coordinate> stations,
                Instant loadedAt, int skippedFiles) {
            this.schedules = schedules;
            this.stations = stations;
            this.loadedAt = loadedAt;
            this.skippedFiles = skippedFiles;
        }
    }
}
