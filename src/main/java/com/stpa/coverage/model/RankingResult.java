package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ranked candidate combinations for one snapshot")
public class RankingResult {

    @Schema(description = "OK, or INSUFFICIENT_CONTROLLERS when fewer than two controllers have in-scope actions",
            example = "OK")
    private RankingStatus status;

    @Schema(description = "SHA-256 fingerprint of snapshot + options + scoring version")
    private String fingerprint;

    @Schema(description = "Number of in-scope controllers considered", example = "3")
    private int inScopeControllerCount;

    @Schema(description = "Number of in-scope actions considered", example = "5")
    private int inScopeActionCount;

    @Schema(description = "Candidates removed because their signature is excluded", example = "0")
    private int excludedCount;

    @Schema(description = "Candidates scored below the minimum risk score", example = "4")
    private int belowThresholdCount;

    @Schema(description = "Candidates dropped because a recorded combination already covers them", example = "1")
    private int duplicateCount;

    private RankingStatistics statistics;

    @Schema(description = "Candidates, highest risk first")
    private List<CandidateCombination> candidates;
}
