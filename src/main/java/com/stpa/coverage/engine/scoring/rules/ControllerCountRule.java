package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * More controllers means more coordination paths that can fail.
 * Points: weight x (distinct controllers - 1).
 */
@Component
public class ControllerCountRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.CONTROLLER_COUNT;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        int controllers = candidate.getControllerIds().size();
        if (controllers < 2) {
            return Optional.empty();
        }
        int points = (controllers - 1) * context.getWeights().getPerExtraController();
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(), points,
                String.format("multiple controllers (%d) involved", controllers)));
    }
}
