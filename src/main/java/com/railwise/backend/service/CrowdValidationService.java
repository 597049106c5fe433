package com.railwise.backend.service;

import com.railwise.backend.model.*;
import com.railwise.backend.repository.DataRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Passenger "I am on this train" confirmations. The in-memory map is
 * authoritative; every change to a train's record is written through to the
 * crowd repository. All access to one train's record is serialized on that
 * record.
 */
@Service
@Slf4j
public class CrowdValidationService {

    private final DataRepository<TrainCrowdRecord, String> crowdRepository;
    private final Clock clock;
    private final RandomSource random;

    @Value("${crowd.active-window-minutes:120}")
    private long activeWindowMinutes = 120;

    private final Map<String, TrainCrowdRecord> records = new ConcurrentHashMap<>();

    public CrowdValidationService(DataRepository<TrainCrowdRecord, String> crowdRepository, Clock clock,
            RandomSource random) {
        this.crowdRepository = crowdRepository;
        this.clock = clock;
        this.random = random;
    }

    @PostConstruct
    public void loadPersisted() {
        List<TrainCrowdRecord> persisted = crowdRepository.findAll();
        for (TrainCrowdRecord record : persisted) {
            if (record.getTrainNumber() == null) {
                continue;
            }
            if (record.getConfirmations() == null) {
                record.setConfirmations(new ArrayList<>());
            }
            records.put(record.getTrainNumber(), record);
        }
        log.info("📂 Loaded crowd confirmations for {} trains", records.size());
    }

    /**
     * Adds a user's confirmation, or refreshes it in place when the user has
     * already confirmed this train.
     */
    public ConfirmationResult confirm(String trainNumber, String userId, String stationName,
            Coordinate coordinates) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("user_id is required");
        }

        String now = Instant.now(clock).toString();
        boolean updated;

        while (true) {
            TrainCrowdRecord record = records.computeIfAbsent(trainNumber,
                    k -> TrainCrowdRecord.builder().trainNumber(k).build());
            synchronized (record) {
                if (records.get(trainNumber) != record) {
                    continue; // removed by cleanup in the meantime
                }
                CrowdConfirmation confirmation = CrowdConfirmation.builder()
                        .userId(userId)
                        .timestamp(now)
                        .stationName(stationName)
                        .coordinates(coordinates)
                        .build();

                updated = false;
                List<CrowdConfirmation> confirmations = record.getConfirmations();
                for (int i = 0; i < confirmations.size(); i++) {
                    if (userId.equals(confirmations.get(i).getUserId())) {
                        confirmations.set(i, confirmation);
                        updated = true;
                        break;
                    }
                }
                if (!updated) {
                    confirmations.add(confirmation);
                }
                record.setTotalConfirmations(confirmations.size());
                record.setLastUpdated(now);
                crowdRepository.save(record);
                break;
            }
        }

        log.info("✅ {} confirmation for train {} from user {}", updated ? "Updated" : "Added", trainNumber, userId);
        return ConfirmationResult.builder()
                .success(true)
                .message(updated ? "Confirmation updated" : "Confirmation added")
                .trainNumber(trainNumber)
                .userId(userId)
                .timestamp(now)
                .crowdMetrics(getMetrics(trainNumber).orElse(null))
                .build();
    }

    public ConfirmationResult removeConfirmation(String trainNumber, String userId) {
        TrainCrowdRecord record = records.get(trainNumber);
        if (record == null) {
            return ConfirmationResult.failure(trainNumber, userId, "No confirmations for this train");
        }

        synchronized (record) {
            boolean removed = record.getConfirmations().removeIf(c -> userId.equals(c.getUserId()));
            if (!removed) {
                return ConfirmationResult.failure(trainNumber, userId, "Confirmation not found");
            }
            String now = Instant.now(clock).toString();
            record.setTotalConfirmations(record.getConfirmations().size());
            record.setLastUpdated(now);
            if (record.getConfirmations().isEmpty()) {
                records.remove(trainNumber, record);
                crowdRepository.deleteById(trainNumber);
            } else {
                crowdRepository.save(record);
            }
            log.info("🗑️ Removed confirmation of user {} for train {}", userId, trainNumber);
            return ConfirmationResult.builder()
                    .success(true)
                    .message("Confirmation removed")
                    .trainNumber(trainNumber)
                    .userId(userId)
                    .timestamp(now)
                    .build();
        }
    }

    /**
     * Crowd metrics over the active confirmations, empty when the train has
     * never been confirmed.
     */
    public Optional<CrowdMetrics> getMetrics(String trainNumber) {
        TrainCrowdRecord record = records.get(trainNumber);
        if (record == null) {
            return Optional.empty();
        }

        Instant now = Instant.now(clock);
        List<CrowdConfirmation> active;
        String lastUpdated;
        synchronized (record) {
            active = activeConfirmations(record, now);
            lastUpdated = record.getLastUpdated();
        }

        int activeUsers = active.size();
        String averageAge;
        String freshness;
        if (active.isEmpty()) {
            averageAge = "no recent confirmations";
            freshness = "low";
        } else {
            double averageMinutes = active.stream()
                    .mapToLong(c -> Duration.between(parseInstant(c.getTimestamp()), now).toMinutes())
                    .average()
                    .orElse(0);
            averageAge = Math.round(averageMinutes) + " minutes ago";
            if (averageMinutes < 30) {
                freshness = "high";
            } else if (averageMinutes < 60) {
                freshness = "medium";
            } else {
                freshness = "low";
            }
        }

        return Optional.of(CrowdMetrics.builder()
                .crowdLevel(CrowdLevel.fromActiveConfirmations(activeUsers))
                .confidence(Confidence.fromActiveConfirmations(activeUsers))
                .activeUsers(activeUsers)
                .averageTimeSinceConfirmation(averageAge)
                .dataFreshness(freshness)
                .lastUpdated(lastUpdated)
                .build());
    }

    public TrainCrowdData getCrowdData(String trainNumber) {
        TrainCrowdRecord record = records.get(trainNumber);
        if (record == null) {
            return TrainCrowdData.builder()
                    .trainNumber(trainNumber)
                    .crowdLevel(CrowdLevel.LOW)
                    .build();
        }

        synchronized (record) {
            List<CrowdConfirmation> active = activeConfirmations(record, Instant.now(clock));
            return TrainCrowdData.builder()
                    .trainNumber(trainNumber)
                    .totalConfirmations(record.getConfirmations().size())
                    .activeConfirmations(active.size())
                    .crowdLevel(CrowdLevel.fromActiveConfirmations(active.size()))
                    .lastUpdated(record.getLastUpdated())
                    .confirmations(active)
                    .build();
        }
    }

    public Map<String, CrowdSummary> getAllTrainValidations() {
        Instant now = Instant.now(clock);
        Map<String, CrowdSummary> summaries = new TreeMap<>();
        records.forEach((trainNumber, record) -> {
            synchronized (record) {
                int active = activeConfirmations(record, now).size();
                summaries.put(trainNumber, CrowdSummary.builder()
                        .totalConfirmations(record.getConfirmations().size())
                        .activeConfirmations(active)
                        .crowdLevel(CrowdLevel.fromActiveConfirmations(active))
                        .lastUpdated(record.getLastUpdated())
                        .build());
            }
        });
        return summaries;
    }

    /**
     * Drops confirmations older than {@code maxAgeHours}, and trains left
     * without any.
     *
     * @return number of trains removed
     */
    public int cleanupOldValidations(int maxAgeHours) {
        Instant cutoff = Instant.now(clock).minus(Duration.ofHours(maxAgeHours));
        int removedTrains = 0;

        for (Map.Entry<String, TrainCrowdRecord> entry : records.entrySet()) {
            TrainCrowdRecord record = entry.getValue();
            synchronized (record) {
                boolean pruned = record.getConfirmations()
                        .removeIf(c -> parseInstant(c.getTimestamp()).isBefore(cutoff));
                if (record.getConfirmations().isEmpty()) {
                    if (records.remove(entry.getKey(), record)) {
                        crowdRepository.deleteById(entry.getKey());
                        removedTrains++;
                    }
                } else if (pruned) {
                    record.setTotalConfirmations(record.getConfirmations().size());
                    crowdRepository.save(record);
                }
            }
        }

        if (removedTrains > 0) {
            log.info("🧹 Cleaned up crowd data for {} trains older than {}h", removedTrains, maxAgeHours);
        }
        return removedTrains;
    }

    /**
     * Applies crowd confirmations to a status report. Only trusted crowd data
     * (medium or high confidence) moves the delay; the input is never modified.
     */
    public TrainStatusReport adjustWithCrowdData(String trainNumber, TrainStatusReport report) {
        Optional<CrowdMetrics> found = getMetrics(trainNumber);
        if (found.isEmpty() || !found.get().getConfidence().isTrusted()) {
            return report;
        }
        CrowdMetrics metrics = found.get();
        int activeUsers = metrics.getActiveUsers();

        int adjustment;
        switch (metrics.getCrowdLevel()) {
            case MEDIUM:
                adjustment = random.nextInt(-2, 2);
                break;
            case HIGH:
                adjustment = random.nextInt(-5, 5);
                break;
            case VERY_HIGH:
                adjustment = random.nextInt(-8, 8);
                break;
            default:
                adjustment = 0;
        }
        if (activeUsers > 20) {
            adjustment = (int) (adjustment * 2.0);
        } else if (activeUsers > 10) {
            adjustment = (int) (adjustment * 1.5);
        }

        TrainStatusReport.TrainStatusReportBuilder adjusted = report.toBuilder()
                .delayMinutes(Math.max(0, report.getDelayMinutes() + adjustment))
                .crowdValidation(CrowdValidationInfo.builder()
                        .confidence(metrics.getConfidence())
                        .activeUsers(activeUsers)
                        .crowdLevel(metrics.getCrowdLevel())
                        .lastUpdated(metrics.getLastUpdated())
                        .build());

        if (metrics.getConfidence() == Confidence.HIGH && activeUsers > 5) {
            adjusted.etaAdjustedByCrowd(true)
                    .crowdEtaConfidence(Confidence.HIGH);
        }

        log.debug("🔍 Crowd adjustment for train {}: {} min ({} active users)", trainNumber, adjustment,
                activeUsers);
        return adjusted.build();
    }

    private List<CrowdConfirmation> activeConfirmations(TrainCrowdRecord record, Instant now) {
        Instant windowStart = now.minus(Duration.ofMinutes(activeWindowMinutes));
        return record.getConfirmations().stream()
                .filter(c -> !parseInstant(c.getTimestamp()).isBefore(windowStart))
                .collect(Collectors.toList());
    }

    private static Instant parseInstant(String timestamp) {
        if (timestamp == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Unparseable confirmation timestamp '{}'", timestamp);
            return Instant.EPOCH;
        }
    }
}
