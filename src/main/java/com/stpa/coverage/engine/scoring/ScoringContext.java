package com.stpa.coverage.engine.scoring;

import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.Controller;
import com.stpa.coverage.model.Finding;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-snapshot lookups shared by all scoring rules: controllers by id, the set of
 * action ids that already carry a finding, and the active weights.
 */
@Getter
public class ScoringContext {

    private final Map<String, Controller> controllers;
    private final Set<String> flaggedActionIds;
    private final AnalysisConfig.ScoringWeights weights;

    public ScoringContext(AnalysisSnapshot snapshot, AnalysisConfig.ScoringWeights weights) {
        this.controllers = snapshot.controllersById();
        this.flaggedActionIds = snapshot.safeFindings().stream()
                .map(Finding::getControlActionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        this.weights = weights;
    }

    public List<Controller> participants(CandidateCombination candidate) {
        return candidate.getControllerIds().stream()
                .map(controllers::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }
}
