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
@Schema(description = "Opens a guided review session over a snapshot")
public class SessionRequest {

    private AnalysisSnapshot snapshot;

    @Schema(description = "Mark cells that already have findings as COMPLETED", example = "true")
    private boolean seedFromFindings;

    @Schema(description = "Who is reviewing", example = "analyst-1")
    private String reviewer;
}
