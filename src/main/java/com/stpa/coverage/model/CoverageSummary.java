package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Coverage totals for a review session")
public class CoverageSummary {

    @Schema(description = "In-scope controllers x in-scope actions x analysis types", example = "21")
    private int totalCells;

    @Schema(example = "10")
    private int completedCells;

    @Schema(example = "2")
    private int skippedCells;

    @Schema(description = "Completed or skipped cells beyond instance 0 (not part of the denominator)", example = "1")
    private int bonusInstances;

    @Schema(description = "(completed + skipped) / total", example = "0.5714")
    private double completionRatio;

    @Schema(description = "True once advance() has run past the last cell")
    private boolean terminal;

    @Schema(description = "Per-controller progress in visiting order")
    private List<ControllerProgress> controllers;
}
