package com.stpa.coverage.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.config.MetricsConfig;
import com.stpa.coverage.engine.CombinationGenerator;
import com.stpa.coverage.engine.ControllerHierarchy;
import com.stpa.coverage.engine.HierarchyBuilder;
import com.stpa.coverage.engine.Prioritizer;
import com.stpa.coverage.engine.RiskScorer;
import com.stpa.coverage.engine.scoring.ScoringContext;
import com.stpa.coverage.event.CombinationDecisionEvent;
import com.stpa.coverage.event.ReviewEventPublisher;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.GenerationOptions;
import com.stpa.coverage.model.HierarchyView;
import com.stpa.coverage.model.RankingResult;
import com.stpa.coverage.model.RankingStatistics;
import com.stpa.coverage.model.RankingStatus;
import com.stpa.coverage.model.RecordedCombination;
import com.stpa.coverage.model.ReviewDecision;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the ranking pipeline for a snapshot.
 *
 * Flow:
 * 1. Build the controller hierarchy (rejects cyclic control structures)
 * 2. Look up the ranking by snapshot fingerprint
 * 3. On a miss: enumerate and score candidates, drop those below the minimum risk score
 *    or already covered by a recorded combination, order the rest, cache the result
 * 4. Drop candidates whose signature reviewers excluded
 */
@Service
public class CombinationAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CombinationAnalysisService.class);

    private final HierarchyBuilder hierarchyBuilder;
    private final CombinationGenerator generator;
    private final RiskScorer riskScorer;
    private final Prioritizer prioritizer;
    private final AnalysisConfig analysisConfig;
    private final Cache<String, RankingResult> rankingCache;
    private final SnapshotFingerprint fingerprint;
    private final MetricsConfig metricsConfig;
    private final ReviewEventPublisher eventPublisher;
    private final Tracer tracer;

    public CombinationAnalysisService(HierarchyBuilder hierarchyBuilder,
                                      CombinationGenerator generator,
                                      RiskScorer riskScorer,
                                      Prioritizer prioritizer,
                                      AnalysisConfig analysisConfig,
                                      Cache<String, RankingResult> rankingCache,
                                      SnapshotFingerprint fingerprint,
                                      MetricsConfig metricsConfig,
                                      ReviewEventPublisher eventPublisher,
                                      Tracer tracer) {
        this.hierarchyBuilder = hierarchyBuilder;
        this.generator = generator;
        this.riskScorer = riskScorer;
        this.prioritizer = prioritizer;
        this.analysisConfig = analysisConfig;
        this.rankingCache = rankingCache;
        this.fingerprint = fingerprint;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
        this.tracer = tracer;
    }

    public RankingResult rank(AnalysisSnapshot snapshot) {
        return rank(snapshot, analysisConfig.toGenerationOptions());
    }

    /**
     * Ranked candidates for the snapshot. Identical snapshot content, options and weights
     * always produce an identical result.
     *
     * @throws com.stpa.coverage.exception.GraphCycleException when the control structure has a cycle
     * @throws com.stpa.coverage.exception.InvalidConfigurationException when the options are invalid
     */
    @Observed(name = "combination.rank", contextualName = "rank-combinations")
    public RankingResult rank(AnalysisSnapshot snapshot, GenerationOptions options) {
        hierarchyBuilder.build(snapshot);

        String key = fingerprint.of(snapshot, options, analysisConfig.getScoring());
        RankingResult cached = rankingCache.getIfPresent(key);
        metricsConfig.recordCacheLookup(cached != null);
        if (cached != null) {
            log.debug("Ranking cache hit for fingerprint {}", key);
            return withoutExcluded(cached);
        }

        RankingResult computed = compute(snapshot, options, key);
        rankingCache.put(key, computed);
        return withoutExcluded(computed);
    }

    private RankingResult compute(AnalysisSnapshot snapshot, GenerationOptions options, String key) {
        int controllerCount = generator.countInScopeControllers(snapshot);
        int actionCount = snapshot.inScopeActions().size();

        if (controllerCount < 2) {
            log.info("Ranking skipped: {} in-scope controller(s), at least 2 required", controllerCount);
            metricsConfig.recordRanking(RankingStatus.INSUFFICIENT_CONTROLLERS.name(), 0);
            return RankingResult.builder()
                    .status(RankingStatus.INSUFFICIENT_CONTROLLERS)
                    .fingerprint(key)
                    .inScopeControllerCount(controllerCount)
                    .inScopeActionCount(actionCount)
                    .candidates(Collections.emptyList())
                    .statistics(RankingStatistics.of(Collections.emptyList()))
                    .build();
        }

        Span span = tracer.nextSpan()
                .name("combination.pipeline")
                .tag("controllers", String.valueOf(controllerCount))
                .tag("actions", String.valueOf(actionCount))
                .tag("max.size", String.valueOf(options.getMaxCombinationSize()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            ScoringContext context = riskScorer.contextFor(snapshot);
            List<CandidateCombination> scored;
            try (Stream<CandidateCombination> candidates = generator.stream(snapshot, options)) {
                scored = candidates.map(c -> riskScorer.apply(c, context)).collect(Collectors.toList());
            }

            List<CandidateCombination> aboveThreshold = scored.stream()
                    .filter(c -> c.getRiskScore() >= options.getMinRiskScore())
                    .collect(Collectors.toList());
            int belowThreshold = scored.size() - aboveThreshold.size();

            List<RecordedCombination> recorded = snapshot.safeRecordedCombinations();
            List<CandidateCombination> fresh = aboveThreshold.stream()
                    .filter(c -> recorded.stream().noneMatch(r -> r.matches(c)))
                    .collect(Collectors.toList());
            int duplicates = aboveThreshold.size() - fresh.size();
            if (belowThreshold > 0 || duplicates > 0) {
                log.debug("Dropped {} candidate(s) below score {} and {} already recorded",
                        belowThreshold, options.getMinRiskScore(), duplicates);
            }

            List<CandidateCombination> ranked = prioritizer.prioritize(fresh);

            for (CandidateCombination candidate : ranked) {
                metricsConfig.recordCandidateScore(candidate.getType().name(), candidate.getRiskScore());
            }
            metricsConfig.recordRanking(RankingStatus.OK.name(), ranked.size());
            span.tag("candidates", String.valueOf(ranked.size()));

            log.info("Ranked {} candidate(s) over {} controllers / {} actions (maxSize={}, weights={})",
                    ranked.size(), controllerCount, actionCount, options.getMaxCombinationSize(),
                    analysisConfig.getScoring().getVersion());

            return RankingResult.builder()
                    .status(RankingStatus.OK)
                    .fingerprint(key)
                    .inScopeControllerCount(controllerCount)
                    .inScopeActionCount(actionCount)
                    .belowThresholdCount(belowThreshold)
                    .duplicateCount(duplicates)
                    .candidates(Collections.unmodifiableList(ranked))
                    .statistics(RankingStatistics.of(ranked))
                    .build();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private RankingResult withoutExcluded(RankingResult result) {
        Set<String> excluded;
        synchronized (analysisConfig) {
            excluded = new HashSet<>(analysisConfig.getExcludedSignatures());
        }
        if (excluded.isEmpty() || result.getCandidates().isEmpty()) {
            return result;
        }
        List<CandidateCombination> kept = result.getCandidates().stream()
                .filter(c -> !excluded.contains(c.getSignature()))
                .collect(Collectors.toList());
        int removed = result.getCandidates().size() - kept.size();
        if (removed > 0) {
            log.debug("Excluded {} candidate(s) by signature", removed);
        }
        return result.toBuilder()
                .candidates(Collections.unmodifiableList(kept))
                .excludedCount(removed)
                .statistics(RankingStatistics.of(kept))
                .build();
    }

    public HierarchyView hierarchy(AnalysisSnapshot snapshot) {
        ControllerHierarchy hierarchy = hierarchyBuilder.build(snapshot);
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String id : hierarchy.visitingOrder()) {
            levels.put(id, hierarchy.levelOf(id));
        }
        return HierarchyView.builder()
                .levels(hierarchy.levels())
                .levelByController(levels)
                .visitingOrder(hierarchy.visitingOrder())
                .build();
    }

    /**
     * Records a reviewer decision on a candidate. A rejected signature is also added to the
     * excluded list so later rankings leave it out; accepting it again takes it back off.
     */
    public CombinationDecisionEvent recordDecision(String signature, ReviewDecision decision,
                                                   String decidedBy, String comment) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("signature is required");
        }
        synchronized (analysisConfig) {
            List<String> excluded = analysisConfig.getExcludedSignatures();
            if (decision == ReviewDecision.REJECTED) {
                if (!excluded.contains(signature)) {
                    excluded.add(signature);
                }
            } else if (excluded.remove(signature)) {
                log.info("Signature {} accepted after rejection, no longer excluded", signature);
            }
        }
        log.info("Decision recorded: signature={}, decision={}, by={}", signature, decision, decidedBy);
        return eventPublisher.publishDecision(signature, decision, decidedBy, comment);
    }
}
