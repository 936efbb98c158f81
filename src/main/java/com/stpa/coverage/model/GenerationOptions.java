package com.stpa.coverage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run enumeration and filtering options. Defaults come from {@code AnalysisConfig}; a request may override them.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {
    int maxCombinationSize;
    boolean includeSameTeamAbstraction;
    boolean includeCrossControllerAbstraction;
    boolean includeCoOccurrenceType;
    boolean includeTemporalOrderingType;
    // Scored candidates below this value are dropped.
    int minRiskScore;
}
