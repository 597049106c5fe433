package com.railwise.backend.controller;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.*;
import com.railwise.backend.service.CrowdValidationService;
import com.railwise.backend.service.PositionService;
import com.railwise.backend.service.TrainService;
import com.railwise.backend.service.TrainTimelineService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrainController.class)
@ExtendWith(OutputCaptureExtension.class)
class TrainControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrainService trainService;

    @MockBean
    private TrainTimelineService trainTimelineService;

    @MockBean
    private PositionService positionService;

    @MockBean
    private CrowdValidationService crowdValidationService;

    @Test
    void testGetStatus_SnakeCaseWithLabels() throws Exception {
        TrainStatusReport report = TrainStatusReport.builder()
                .trainNumber("701")
                .trainName("SUBARNA EXPRESS (701)")
                .stationStatuses(List.of(StationStatus.builder()
                        .stationName("Feni")
                        .status(StationStatusType.CURRENT)
                        .crowdLevel(CrowdLevel.VERY_HIGH)
                        .build()))
                .delayMinutes(12)
                .currentStation("Feni")
                .lastUpdated(LocalDateTime.of(2026, 10, 19, 10, 30))
                .build();
        when(trainTimelineService.getTrainStatus("701")).thenReturn(report);

        mockMvc.perform(get("/api/v1/trains/701/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.train_number").value("701"))
                .andExpect(jsonPath("$.delay_minutes").value(12))
                .andExpect(jsonPath("$.station_statuses[0].status").value("current"))
                .andExpect(jsonPath("$.station_statuses[0].crowd_level").value("very_high"))
                .andExpect(jsonPath("$.crowd_validation").doesNotExist());
    }

    @Test
    void testGetStatus_UnknownTrainIs404() throws Exception {
        when(trainTimelineService.getTrainStatus("999")).thenThrow(new TrainNotFoundException("999"));

        mockMvc.perform(get("/api/v1/trains/999/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.path").value("/api/v1/trains/999/status"));
    }

    @Test
    void testGetPosition_Unavailable() throws Exception {
        when(positionService.positionSnapshot("701")).thenReturn(
                PositionSnapshot.unavailable("701", "No parseable schedule times for this train",
                        LocalDateTime.of(2026, 10, 19, 10, 30)));

        mockMvc.perform(get("/api/v1/trains/701/position"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false))
                .andExpect(jsonPath("$.current_station").doesNotExist());
    }

    @Test
    void testSearch_MissingCriteriaIs400() throws Exception {
        when(trainService.search(isNull(), isNull(), isNull()))
                .thenThrow(new IllegalArgumentException("Provide either 'number' or both 'from' and 'to'"));

        mockMvc.perform(get("/api/v1/trains/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
    }

    @Test
    void testConfirm_ReadsSnakeCaseBody() throws Exception {
        when(crowdValidationService.confirm(eq("701"), eq("u1"), eq("Feni"), any()))
                .thenReturn(ConfirmationResult.builder()
                        .success(true)
                        .message("Confirmation added")
                        .trainNumber("701")
                        .userId("u1")
                        .build());

        mockMvc.perform(post("/api/v1/trains/701/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"station_name\":\"Feni\",\"coordinates\":{\"longitude\":91.4,\"latitude\":23.0}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Confirmation added"));

        verify(trainService).requireSchedule("701");
    }

    @Test
    void testConfirm_UnknownTrainIs404() throws Exception {
        when(trainService.requireSchedule("999")).thenThrow(new TrainNotFoundException("999"));

        mockMvc.perform(post("/api/v1/trains/999/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\"}"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(crowdValidationService);
    }

    @Test
    void testRemoveConfirmation_MissingIs404(CapturedOutput output) throws Exception {
        when(crowdValidationService.removeConfirmation("701", "u1"))
                .thenReturn(ConfirmationResult.failure("701", "u1", "Confirmation not found"));

        mockMvc.perform(delete("/api/v1/trains/701/confirm/u1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Confirmation not found"));

        assertTrue(output.getOut().contains("Removing confirmation of user u1 on train 701: not found"));
    }
}
