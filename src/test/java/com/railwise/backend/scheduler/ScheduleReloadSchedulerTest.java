package com.railwise.backend.scheduler;

import com.railwise.backend.repository.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(OutputCaptureExtension.class)
class ScheduleReloadSchedulerTest {

    @Mock
    private ScheduleStore scheduleStore;

    private ScheduleReloadScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        scheduler = new ScheduleReloadScheduler(scheduleStore);
    }

    @Test
    void testReload_ReloadsStoreAndLogs(CapturedOutput output) {
        scheduler.reload();

        verify(scheduleStore).reload();
        assertTrue(output.getOut().contains("Scheduled reload of schedules and stations"));
    }
}
