package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One (controller, action, analysis type, instance) review cell and its state")
public class CoverageCell {

    @Schema(example = "CTRL-AP")
    private String controllerId;

    @Schema(example = "CA-AP-1")
    private String controlActionId;

    @Schema(example = "NOT_PROVIDED")
    private String analysisTypeId;

    @Schema(example = "0")
    private int instanceIndex;

    @Schema(example = "UNVISITED")
    private CellState state;

    @Schema(description = "Hierarchy level of the controller", example = "0")
    private int hierarchyLevel;

    public static CoverageCell of(CellKey key, CellState state, int hierarchyLevel) {
        return CoverageCell.builder()
                .controllerId(key.controllerId())
                .controlActionId(key.controlActionId())
                .analysisTypeId(key.analysisTypeId())
                .instanceIndex(key.instanceIndex())
                .state(state)
                .hierarchyLevel(hierarchyLevel)
                .build();
    }

    public CellKey key() {
        return new CellKey(controllerId, controlActionId, analysisTypeId, instanceIndex);
    }
}
