package com.railwise.backend.service;

import com.railwise.backend.model.CrowdSummary;
import com.railwise.backend.model.DataLoadStatus;
import com.railwise.backend.model.RefreshSummary;
import com.railwise.backend.model.SystemStatus;
import com.railwise.backend.repository.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
public class SystemStatusService {

    private final ScheduleStore scheduleStore;
    private final CrowdValidationService crowdValidationService;
    private final Clock clock;

    @Value("${railwise.api.version:2.0.0}")
    private String apiVersion = "2.0.0";

    @Value("${crowd.cleanup.max-age-hours:24}")
    private int cleanupMaxAgeHours = 24;

    public SystemStatusService(ScheduleStore scheduleStore, CrowdValidationService crowdValidationService,
            Clock clock) {
        this.scheduleStore = scheduleStore;
        this.crowdValidationService = crowdValidationService;
        this.clock = clock;
    }

    public SystemStatus getSystemStatus() {
        DataLoadStatus data = scheduleStore.getStatus();
        Collection<CrowdSummary> crowd = crowdValidationService.getAllTrainValidations().values();

        boolean schedulesLoaded = data.getSchedulesCount() > 0;
        boolean stationsLoaded = data.getStationsCount() > 0;

        Map<String, String> health = new LinkedHashMap<>();
        health.put("schedules", schedulesLoaded ? "ok" : "empty");
        health.put("stations", stationsLoaded ? "ok" : "empty");
        health.put("crowd_validation", "ok");
        health.put("delay_model", "simulated");

        return SystemStatus.builder()
                .status(schedulesLoaded && stationsLoaded ? "healthy" : "unhealthy")
                .version(apiVersion)
                .dataSources(data)
                .crowdValidations(SystemStatus.CrowdTotals.builder()
                        .totalTrains(crowd.size())
                        .totalConfirmations(crowd.stream().mapToInt(CrowdSummary::getTotalConfirmations).sum())
                        .activeConfirmations(crowd.stream().mapToInt(CrowdSummary::getActiveConfirmations).sum())
                        .build())
                .systemHealth(health)
                .lastUpdated(Instant.now(clock).toString())
                .build();
    }

    /**
     * Reloads the reference data and drops stale crowd confirmations.
     */
    public RefreshSummary refreshData() {
        log.info("🔄 Refreshing reference data and crowd confirmations");
        DataLoadStatus status = scheduleStore.reload();
        int cleaned = crowdValidationService.cleanupOldValidations(cleanupMaxAgeHours);

        return RefreshSummary.builder()
                .message("Data refreshed successfully")
                .dataStatus(status)
                .cleanedValidations(cleaned)
                .timestamp(Instant.now(clock).toString())
                .build();
    }
}
