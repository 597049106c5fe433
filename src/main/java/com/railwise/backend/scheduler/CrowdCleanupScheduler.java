package com.railwise.backend.scheduler;

import com.railwise.backend.service.CrowdValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class CrowdCleanupScheduler {

    private final CrowdValidationService crowdValidationService;

    @Value("${crowd.cleanup.max-age-hours:24}")
    private int maxAgeHours;

    @Scheduled(cron = "${crowd.cleanup.cron}")
    public void cleanup() {
        int removed = crowdValidationService.cleanupOldValidations(maxAgeHours);
        log.debug("🧹 Crowd cleanup finished, {} trains removed", removed);
    }
}
