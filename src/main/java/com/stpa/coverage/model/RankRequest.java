package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ranking request: a snapshot plus optional per-request overrides of the configured options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Snapshot to rank, with optional enumeration overrides")
public class RankRequest {

    private AnalysisSnapshot snapshot;

    @Schema(description = "Overrides analysis.max-combination-size", example = "2")
    private Integer maxCombinationSize;

    private Boolean includeSameTeamAbstraction;
    private Boolean includeCrossControllerAbstraction;
    private Boolean includeCoOccurrenceType;
    private Boolean includeTemporalOrderingType;

    @Schema(description = "Overrides analysis.min-risk-score", example = "30")
    private Integer minRiskScore;

    public GenerationOptions applyTo(GenerationOptions defaults) {
        GenerationOptions.GenerationOptionsBuilder builder = defaults.toBuilder();
        if (maxCombinationSize != null) builder.maxCombinationSize(maxCombinationSize);
        if (includeSameTeamAbstraction != null) builder.includeSameTeamAbstraction(includeSameTeamAbstraction);
        if (includeCrossControllerAbstraction != null) {
            builder.includeCrossControllerAbstraction(includeCrossControllerAbstraction);
        }
        if (includeCoOccurrenceType != null) builder.includeCoOccurrenceType(includeCoOccurrenceType);
        if (includeTemporalOrderingType != null) builder.includeTemporalOrderingType(includeTemporalOrderingType);
        if (minRiskScore != null) builder.minRiskScore(minRiskScore);
        return builder.build();
    }
}
