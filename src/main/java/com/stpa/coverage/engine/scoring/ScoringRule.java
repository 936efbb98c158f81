package com.stpa.coverage.engine.scoring;

import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;

import java.util.Optional;

/**
 * Interface for all additive risk terms.
 * Each implementation handles one ScoringRuleType.
 */
public interface ScoringRule {

    ScoringRuleType getSupportedRuleType();

    /**
     * @return the points and rationale phrase, or empty when the rule does not fire
     */
    Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context);
}
