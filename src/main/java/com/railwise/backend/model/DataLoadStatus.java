package com.railwise.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataLoadStatus {
    private int stationsCount;
    private int schedulesCount;
    private int skippedFiles;
    private String lastLoaded;
}
