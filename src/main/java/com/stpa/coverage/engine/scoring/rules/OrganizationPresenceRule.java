package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.ControllerType;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class OrganizationPresenceRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.ORGANIZATION_PRESENCE;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        boolean organizationInvolved = context.participants(candidate).stream()
                .anyMatch(c -> c.getType() == ControllerType.ORGANIZATION);
        if (!organizationInvolved) {
            return Optional.empty();
        }
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(),
                context.getWeights().getOrganizationPresent(), "organizational controller involved"));
    }
}
