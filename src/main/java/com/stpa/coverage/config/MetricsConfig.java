package com.stpa.coverage.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeSessions = registry.gauge("review.sessions.active", new AtomicInteger(0));
    }

    public void recordRanking(String status, int candidateCount) {
        DistributionSummary.builder("combination.generated")
                .tag("status", status)
                .register(registry)
                .record(candidateCount);
    }

    public void recordCandidateScore(String type, int score) {
        DistributionSummary.builder("combination.score")
                .tag("type", type)
                .register(registry)
                .record(score);
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("ranking.cache.count")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordDecision(String decision) {
        Counter.builder("combination.decision.count")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordCoverageTransition(String transition) {
        Counter.builder("coverage.transition.count")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    public void updateActiveSessions(int count) {
        activeSessions.set(count);
    }
}
