package com.railwise.backend.scheduler;

import com.railwise.backend.repository.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleReloadScheduler {

    private final ScheduleStore scheduleStore;

    /**
     * Picks up edited schedule and station files without a restart.
     */
    @Scheduled(fixedRateString = "${schedule.reload.interval}", initialDelayString = "${schedule.reload.interval}")
    public void reload() {
        log.info("🔄 Scheduled reload of schedules and stations");
        scheduleStore.reload();
    }
}
