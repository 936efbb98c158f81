package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.Controller;
import com.stpa.coverage.model.ControllerType;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Mixed controller types (e.g. human + software) interpret the process differently.
 * Points: weight x (distinct controller types - 1).
 */
@Component
public class TypeDiversityRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.TYPE_DIVERSITY;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        Set<ControllerType> types = EnumSet.noneOf(ControllerType.class);
        for (Controller controller : context.participants(candidate)) {
            if (controller.getType() != null) {
                types.add(controller.getType());
            }
        }
        if (types.size() < 2) {
            return Optional.empty();
        }
        int points = (types.size() - 1) * context.getWeights().getPerExtraControllerType();
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(), points,
                String.format("controller type diversity (%d types)", types.size())));
    }
}
