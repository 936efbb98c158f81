package com.stpa.coverage.engine.scoring.rules;

import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoringRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Teams declaring several roles carry internal authority conflicts.
 * Points: weight x participating teams with two or more roles.
 */
@Component
public class MultiRoleTeamRule implements ScoringRule {

    @Override
    public ScoringRuleType getSupportedRuleType() {
        return ScoringRuleType.MULTI_ROLE_TEAM;
    }

    @Override
    public Optional<ScoreContribution> evaluate(CandidateCombination candidate, ScoringContext context) {
        long teams = context.participants(candidate).stream()
                .filter(c -> c.isTeam() && c.roleCount() >= 2)
                .count();
        if (teams == 0) {
            return Optional.empty();
        }
        int points = (int) teams * context.getWeights().getPerMultiRoleTeam();
        return Optional.of(new ScoreContribution(getSupportedRuleType().name(), points,
                String.format("%d team(s) with multiple roles", teams)));
    }
}
