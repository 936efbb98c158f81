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
@Schema(description = "State of a guided review session")
public class ReviewSession {

    @Schema(example = "3f2b8c1e-6a0d-4c55-9e1f-0b7d2a9c4e11")
    private String sessionId;

    private String reviewer;

    private long createdAt;

    @Schema(description = "Current cell, absent once the traversal is terminal")
    private CoverageCell currentCell;

    @Schema(description = "Last controller movement", example = "LATERAL")
    private Movement lastMovement;

    private CoverageSummary summary;
}
