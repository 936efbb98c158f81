package com.stpa.coverage.service;

import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.config.MetricsConfig;
import com.stpa.coverage.engine.ControllerHierarchy;
import com.stpa.coverage.engine.HierarchyBuilder;
import com.stpa.coverage.engine.coverage.CoverageTracker;
import com.stpa.coverage.event.ReviewEventPublisher;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CellKey;
import com.stpa.coverage.model.CoverageCell;
import com.stpa.coverage.model.CoverageSummary;
import com.stpa.coverage.model.ReviewSession;
import com.stpa.coverage.model.SessionRequest;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of guided review sessions, one {@link CoverageTracker} each.
 * Lookups of an unknown session id return {@code null}.
 */
@Service
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final HierarchyBuilder hierarchyBuilder;
    private final AnalysisConfig analysisConfig;
    private final ReviewEventPublisher eventPublisher;
    private final MetricsConfig metricsConfig;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public ReviewSessionService(HierarchyBuilder hierarchyBuilder,
                                AnalysisConfig analysisConfig,
                                ReviewEventPublisher eventPublisher,
                                MetricsConfig metricsConfig) {
        this.hierarchyBuilder = hierarchyBuilder;
        this.analysisConfig = analysisConfig;
        this.eventPublisher = eventPublisher;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @throws com.stpa.coverage.exception.GraphCycleException when the control structure has a cycle
     */
    @Observed(name = "review.session.create", contextualName = "create-review-session")
    public ReviewSession createSession(SessionRequest request) {
        AnalysisSnapshot snapshot = request.getSnapshot();
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot is required");
        }
        List<String> analysisTypes = List.copyOf(analysisConfig.getAnalysisTypes());
        if (analysisTypes.isEmpty()) {
            throw new IllegalArgumentException("analysis.analysis-types must not be empty");
        }

        ControllerHierarchy hierarchy = hierarchyBuilder.build(snapshot);
        String sessionId = UUID.randomUUID().toString();
        CoverageTracker tracker = new CoverageTracker(snapshot, hierarchy, analysisTypes,
                eventPublisher.listenerFor(sessionId));
        if (request.isSeedFromFindings()) {
            tracker.seedFromFindings();
        }

        Session session = new Session(sessionId, request.getReviewer(), System.currentTimeMillis(), tracker);
        sessions.put(sessionId, session);
        metricsConfig.updateActiveSessions(sessions.size());

        log.info("Review session created: id={}, reviewer={}, cells={}, seeded={}",
                sessionId, request.getReviewer(), tracker.summary().getTotalCells(), request.isSeedFromFindings());
        return view(session);
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public ReviewSession getSession(String sessionId) {
        Session session = sessions.get(sessionId);
        return session == null ? null : view(session);
    }

    public boolean deleteSession(String sessionId) {
        Session removed = sessions.remove(sessionId);
        metricsConfig.updateActiveSessions(sessions.size());
        if (removed != null) {
            log.info("Review session closed: id={}, completion={}", sessionId,
                    removed.tracker().completionRatio());
        }
        return removed != null;
    }

    public ReviewSession advance(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) return null;
        session.tracker().advance();
        return view(session);
    }

    public ReviewSession retreat(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) return null;
        session.tracker().retreat();
        return view(session);
    }

    /**
     * Adds an instance to {@code key}'s cell, or to the current cell when {@code key} is null.
     * Returns {@code null} when the session is unknown or the cell is not in scope.
     */
    public CoverageCell addInstance(String sessionId, CellKey key) {
        Session session = sessions.get(sessionId);
        if (session == null) return null;
        return key == null ? session.tracker().addInstance() : session.tracker().addInstance(key);
    }

    /** {@code null} for an unknown session, otherwise whether the cell was in scope. */
    public Boolean markCompleted(String sessionId, CellKey key) {
        Session session = sessions.get(sessionId);
        if (session == null) return null;
        return session.tracker().markCompleted(key);
    }

    public Boolean markSkipped(String sessionId, CellKey key) {
        Session session = sessions.get(sessionId);
        if (session == null) return null;
        return session.tracker().markSkipped(key);
    }

    /**
     * Re-scopes an open session. Recorded cell states survive.
     *
     * @throws com.stpa.coverage.exception.GraphCycleException when the new control structure has a cycle
     */
    public ReviewSession updateSnapshot(String sessionId, AnalysisSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot is required");
        }
        Session session = sessions.get(sessionId);
        if (session == null) return null;

        ControllerHierarchy hierarchy = hierarchyBuilder.build(snapshot);
        session.tracker().updateSnapshot(snapshot, hierarchy);
        log.info("Review session {} re-scoped: {} cells in scope", sessionId,
                session.tracker().summary().getTotalCells());
        return view(session);
    }

    public CoverageSummary summary(String sessionId) {
        Session session = sessions.get(sessionId);
        return session == null ? null : session.tracker().summary();
    }

    public List<CoverageCell> cells(String sessionId) {
        Session session = sessions.get(sessionId);
        return session == null ? null : session.tracker().cells();
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private ReviewSession view(Session session) {
        CoverageTracker tracker = session.tracker();
        synchronized (tracker) {
            return ReviewSession.builder()
                    .sessionId(session.id())
                    .reviewer(session.reviewer())
                    .createdAt(session.createdAt())
                    .currentCell(tracker.currentCell())
                    .lastMovement(tracker.lastMovement())
                    .summary(tracker.summary())
                    .build();
        }
    }

    private record Session(String id, String reviewer, long createdAt, CoverageTracker tracker) {
    }
}
