package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.List;

/**
 * A combination finding the external store already holds. Candidates covering the same
 * actions are not proposed again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Combination finding already recorded for this analysis")
public class RecordedCombination {

    @Schema(example = "UCCA-12")
    private String id;

    @Schema(description = "Control actions the recorded combination involves", example = "[\"CA-AP-1\", \"CA-PF-2\"]")
    private List<String> actionIds;

    @Schema(description = "Combination type; absent matches either type", example = "CO_OCCURRENCE")
    private CombinationType type;

    private String description;

    /** Same set of actions, and the same type unless this record leaves the type open. */
    public boolean matches(CandidateCombination candidate) {
        if (actionIds == null || candidate.getActionIds() == null) return false;
        if (type != null && type != candidate.getType()) return false;
        return new HashSet<>(actionIds).equals(new HashSet<>(candidate.getActionIds()));
    }
}
