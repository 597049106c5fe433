package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.TrainCrowdData;
import com.railwise.backend.model.TrainSearchResponse;
import com.railwise.backend.model.TrainSummary;
import com.railwise.backend.repository.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static com.railwise.backend.service.TestSchedules.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(OutputCaptureExtension.class)
class TrainServiceTest {

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private CrowdValidationService crowdValidationService;

    private TrainService trainService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        PositionService positionService = new PositionService(scheduleStore, new ScriptedRandomSource(),
                clockAt(LocalDateTime.of(2026, 10, 19, 10, 30)));
        trainService = new TrainService(scheduleStore, positionService, crowdValidationService);
        stubStations(scheduleStore);
        stubSchedule(scheduleStore, threeStopSchedule());
    }

    @Test
    void testSearch_ByNumberTakesPrecedence() {
        when(scheduleStore.findByNumberOrName("100")).thenReturn(List.of(threeStopSchedule()));

        TrainSearchResponse response = trainService.search(" 100 ", "Alpha", "Charlie");

        assertEquals("train_number", response.getSearchType());
        assertEquals(1, response.getTotalCount());
        assertNull(response.getMessage());
        verify(scheduleStore, never()).findByStations(anyString(), anyString());
    }

    @Test
    void testSearch_LogsMatchCount(CapturedOutput output) {
        when(scheduleStore.findByNumberOrName("100")).thenReturn(List.of(threeStopSchedule()));
        when(scheduleStore.findByStations("Alpha", "Charlie")).thenReturn(List.of(threeStopSchedule()));

        trainService.search("100", null, null);
        trainService.search(null, "Alpha", "Charlie");

        assertTrue(output.getOut().contains("Search for train '100' matched 1 train(s)"));
        assertTrue(output.getOut().contains("Search Alpha -> Charlie matched 1 train(s)"));
    }

    @Test
    void testSearch_ByStationPair() {
        when(scheduleStore.findByStations("Charlie", "Alpha")).thenReturn(Collections.emptyList());

        TrainSearchResponse response = trainService.search(null, "Charlie", "Alpha");

        assertEquals("station_to_station", response.getSearchType());
        assertEquals(0, response.getTotalCount());
        assertEquals("No trains found from Charlie to Alpha", response.getMessage());
    }

    @Test
    void testSearch_MissingCriteria() {
        assertThrows(IllegalArgumentException.class, () -> trainService.search(null, "Alpha", null));
        assertThrows(IllegalArgumentException.class, () -> trainService.search("", null, null));
    }

    @Test
    void testGetSummary() {
        TrainCrowdData crowd = TrainCrowdData.builder().trainNumber("100").build();
        when(crowdValidationService.getCrowdData("100")).thenReturn(crowd);

        TrainSummary summary = trainService.getSummary("100");

        assertEquals("Alpha", summary.getRouteSummary().getOrigin());
        assertEquals("Charlie", summary.getRouteSummary().getDestination());
        assertEquals(22.24, summary.getRouteSummary().getTotalDistance());
        assertEquals("9:00 am BST", summary.getScheduleInfo().getDepartureTime());
        assertEquals("11:00 am BST", summary.getScheduleInfo().getArrivalTime());
        assertEquals(3, summary.getTotalStations());
        assertSame(crowd, summary.getCrowdData());
    }

    @Test
    void testGetSummary_UnknownTrain() {
        assertThrows(TrainNotFoundException.class, () -> trainService.getSummary("999"));
    }
}
