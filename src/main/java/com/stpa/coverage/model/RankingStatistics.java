package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Breakdown of the returned candidates")
public class RankingStatistics {

    @Schema(example = "12")
    private int totalCandidates;

    @Schema(description = "Candidates per combination type, every type listed")
    private Map<CombinationType, Integer> countsByType;

    @Schema(description = "Candidates per abstraction level, every level listed")
    private Map<AbstractionLevel, Integer> countsByAbstraction;

    @Schema(description = "Candidates banded HIGH or CRITICAL", example = "3")
    private int highRiskCount;

    @Schema(description = "Mean risk score, 0 when there are no candidates", example = "41.5")
    private double averageRiskScore;

    public static RankingStatistics of(List<CandidateCombination> candidates) {
        Map<CombinationType, Integer> byType = new EnumMap<>(CombinationType.class);
        for (CombinationType type : CombinationType.values()) byType.put(type, 0);
        Map<AbstractionLevel, Integer> byAbstraction = new EnumMap<>(AbstractionLevel.class);
        for (AbstractionLevel level : AbstractionLevel.values()) byAbstraction.put(level, 0);

        int highRisk = 0;
        long scoreSum = 0;
        for (CandidateCombination c : candidates) {
            byType.merge(c.getType(), 1, Integer::sum);
            byAbstraction.merge(c.getAbstraction(), 1, Integer::sum);
            if (c.getRiskBand() == RiskBand.HIGH || c.getRiskBand() == RiskBand.CRITICAL) highRisk++;
            scoreSum += c.getRiskScore();
        }

        return RankingStatistics.builder()
                .totalCandidates(candidates.size())
                .countsByType(byType)
                .countsByAbstraction(byAbstraction)
                .highRiskCount(highRisk)
                .averageRiskScore(candidates.isEmpty() ? 0.0 : (double) scoreSum / candidates.size())
                .build();
    }
}
