package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.Controller;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class TeamPresenceRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.TEAM_PRESENCE;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        boolean teamInvolved = context.participants(candidate).stream().anyMatch(Controller::isTeam);
        if (!teamInvolved) {
            return Optional.empty();
        }
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(),
                context.getWeights().getTeamPresent(), "team coordination required"));
    }
}
