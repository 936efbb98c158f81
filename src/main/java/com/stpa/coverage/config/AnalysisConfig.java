package com.stpa.coverage.config;

import com.stpa.coverage.model.GenerationOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    // Largest combination enumerated. Must be >= 2 and <= number of in-scope controllers.
    private int maxCombinationSize = 3;

    // Abstraction policy flags: same Team vs everything else.
    private boolean includeSameTeamAbstraction = true;
    private boolean includeCrossControllerAbstraction = true;

    // Combination types generated for each eligible subset.
    private boolean includeCoOccurrenceType = true;
    private boolean includeTemporalOrderingType = true;

    // Ordered analysis types; drives the per-action cell count of a review session.
    private List<String> analysisTypes = new ArrayList<>(List.of(
            "NOT_PROVIDED", "PROVIDED_UNSAFE", "TOO_EARLY", "TOO_LATE",
            "WRONG_ORDER", "TOO_LONG", "TOO_SHORT"));

    // Candidates scoring below this are not returned (0 keeps everything).
    private int minRiskScore = 0;

    // Candidate signatures reviewers have ruled out permanently.
    private List<String> excludedSignatures = new ArrayList<>();

    private Cache cache = new Cache();

    private ScoringWeights scoring = new ScoringWeights();

    public GenerationOptions toGenerationOptions() {
        return GenerationOptions.builder()
                .maxCombinationSize(maxCombinationSize)
                .includeSameTeamAbstraction(includeSameTeamAbstraction)
                .includeCrossControllerAbstraction(includeCrossControllerAbstraction)
                .includeCoOccurrenceType(includeCoOccurrenceType)
                .includeTemporalOrderingType(includeTemporalOrderingType)
                .minRiskScore(minRiskScore)
                .build();
    }

    @Data
    public static class Cache {
        private long maxEntries = 256;
        private long expireAfterWriteMinutes = 30;
    }

    /**
     * Additive risk weights. Bump {@code version} whenever a weight changes so scores
     * recorded under an older version stay attributable.
     */
    @Data
    public static class ScoringWeights {
        private String version = "v1";
        private int perExtraController = 10;
        private int perExtraControllerType = 5;
        private int teamPresent = 15;
        private int organizationPresent = 20;
        private int perFlaggedAction = 10;
        private int perMultiRoleTeam = 8;
    }
}
