package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actions that already carry an unsafe-action finding mark known risk areas.
 * Points: weight x flagged actions in the combination.
 */
@Component
public class FlaggedActionRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.FLAGGED_ACTION;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        long flagged = candidate.getActionIds().stream()
                .filter(context.getFlaggedActionIds()::contains)
                .count();
        if (flagged == 0) {
            return Optional.empty();
        }
        int points = (int) flagged * context.getWeights().getPerFlaggedAction();
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(), points,
                String.format("%d action(s) already flagged", flagged)));
    }
}
