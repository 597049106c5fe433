package com.railwise.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfirmationResult {
    private boolean success;
    private String message;
    private String error;
    private String trainNumber;
    private String userId;
    private String timestamp;
    private CrowdMetrics crowdMetrics;

    public static ConfirmationResult failure(String trainNumber, String userId, String error) {
        return ConfirmationResult.builder()
                .success(false)
                .trainNumber(trainNumber)
                .userId(userId)
                .error(error)
                .build();
    }
}
