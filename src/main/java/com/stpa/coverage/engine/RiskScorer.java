package com.stpa.coverage.engine;

import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.engine.scoring.ScoringRule;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.RiskBand;
import com.stpa.coverage.model.ScoreContribution;
import com.stpa.coverage.model.ScoreResult;
import com.stpa.coverage.model.ScoringRuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores candidates with the registered additive rules.
 * Uses the Strategy pattern: each ScoringRuleType is handled by one ScoringRule, and rules
 * run in enum declaration order so the rationale is stable.
 */
@Component
public class RiskScorer {

    private static final Logger log = LoggerFactory.getLogger(RiskScorer.class);

    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    private final Map<ScoringRuleType, ScoringRule> ruleMap;
    private final AnalysisConfig analysisConfig;

    public RiskScorer(List<ScoringRule> rules, AnalysisConfig analysisConfig) {
        this.ruleMap = new EnumMap<>(ScoringRuleType.class);
        this.analysisConfig = analysisConfig;

        // Auto-register all rule implementations
        for (ScoringRule rule : rules) {
            ruleMap.put(rule.getSupportedRuleType(), rule);
            log.info("Registered scoring rule: {} -> {}",
                    rule.getSupportedRuleType(), rule.getClass().getSimpleName());
        }
    }

    public ScoringContext contextFor(AnalysisSnapshot snapshot) {
        return new ScoringContext(snapshot, analysisConfig.getScoring());
    }

    public ScoreResult score(CandidateCombination candidate, ScoringContext context) {
        List<ScoreContribution> fired = new ArrayList<>();
        int sum = 0;

        for (ScoringRule rule : ruleMap.values()) {
            Optional<ScoreContribution> contribution = rule.evaluate(candidate, context);
            if (contribution.isPresent() && contribution.get().points() != 0) {
                fired.add(contribution.get());
                sum += contribution.get().points();
            }
        }

        int value = Math.max(MIN_SCORE, Math.min(MAX_SCORE, sum));
        String rationale = fired.isEmpty()
                ? "no risk factors matched"
                : fired.stream().map(ScoreContribution::reason).collect(Collectors.joining("; "));

        if (log.isDebugEnabled()) {
            log.debug("Scored {}: raw={}, clamped={}, rules={}", candidate.getSignature(), sum, value,
                    fired.stream().map(ScoreContribution::ruleId).collect(Collectors.toList()));
        }
        return new ScoreResult(value, rationale, List.copyOf(fired), context.getWeights().getVersion());
    }

    /** Copy of the candidate carrying its score, band, rationale and scoring version. */
    public CandidateCombination apply(CandidateCombination candidate, ScoringContext context) {
        ScoreResult result = score(candidate, context);
        return candidate.toBuilder()
                .riskScore(result.value())
                .riskBand(RiskBand.fromScore(result.value()))
                .rationale(result.rationale())
                .scoringVersion(result.version())
                .build();
    }
}
