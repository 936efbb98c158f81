package com.stpa.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControllerProgress {
    private String controllerId;
    private int hierarchyLevel;
    private int totalCells;
    private int completedCells;
    private int skippedCells;
    private double completionRatio;
}
