package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshSummary {
    private String message;
    private DataLoadStatus dataStatus;
    private int cleanedValidations;
    private String timestamp;
}
