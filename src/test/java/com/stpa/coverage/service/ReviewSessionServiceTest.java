package com.stpa.coverage.service;

import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.config.MetricsConfig;
import com.stpa.coverage.engine.HierarchyBuilder;
import com.stpa.coverage.engine.coverage.CoverageTransition;
import com.stpa.coverage.event.ReviewEventPublisher;
import com.stpa.coverage.exception.GraphCycleException;
import com.stpa.coverage.model.*;
import com.stpa.coverage.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static com.stpa.coverage.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewSessionServiceTest {

    private static final CellKey FIRST = new CellKey("CTRL-AP", "CA-AP-1", "NOT_PROVIDED", 0);

    @Mock private ReviewEventPublisher eventPublisher;
    @Mock private MetricsConfig metricsConfig;

    private ReviewSessionService service;

    @BeforeEach
    void setUp() {
        AnalysisConfig config = TestDataFactory.analysisConfig();
        service = new ReviewSessionService(new HierarchyBuilder(), config, eventPublisher, metricsConfig);
    }

    private ReviewSession open(AnalysisSnapshot snapshot, boolean seed) {
        return service.createSession(SessionRequest.builder()
                .snapshot(snapshot)
                .seedFromFindings(seed)
                .reviewer("analyst-1")
                .build());
    }

    @Test
    void createSession_positionsOnFirstCell() {
        ReviewSession session = open(TestDataFactory.coverageSnapshot(), false);

        assertThat(session.getSessionId()).isNotBlank();
        assertThat(session.getReviewer()).isEqualTo("analyst-1");
        assertThat(session.getCurrentCell().key()).isEqualTo(FIRST);
        assertThat(session.getLastMovement()).isEqualTo(Movement.INITIAL);
        assertThat(session.getSummary().getTotalCells()).isEqualTo(6);
        assertThat(service.hasSession(session.getSessionId())).isTrue();
        verify(metricsConfig).updateActiveSessions(1);
    }

    @Test
    void createSession_withSeed_marksExistingFindings() {
        AnalysisSnapshot snapshot = TestDataFactory.coverageSnapshot();
        snapshot.getFindings().add(finding("F-1", "CTRL-PF", "CA-PF-1", "TOO_LATE"));

        ReviewSession session = open(snapshot, true);

        assertThat(session.getSummary().getCompletedCells()).isEqualTo(1);
    }

    @Test
    void createSession_cyclicStructure_throwsAndStoresNothing() {
        AnalysisSnapshot snapshot = TestDataFactory.coverageSnapshot();
        snapshot.getControlPaths().add(path("CP-9", "CTRL-AP", "CTRL-PF"));

        assertThatThrownBy(() -> open(snapshot, false)).isInstanceOf(GraphCycleException.class);
        assertThat(service.activeSessionCount()).isZero();
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void createSession_withoutSnapshot_throws() {
        assertThatThrownBy(() -> service.createSession(new SessionRequest()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("snapshot");
    }

    @Test
    void unknownSession_returnsNull() {
        assertThat(service.getSession("missing")).isNull();
        assertThat(service.advance("missing")).isNull();
        assertThat(service.retreat("missing")).isNull();
        assertThat(service.markCompleted("missing", FIRST)).isNull();
        assertThat(service.addInstance("missing", null)).isNull();
        assertThat(service.summary("missing")).isNull();
        assertThat(service.deleteSession("missing")).isFalse();
    }

    @Test
    void advanceAndRetreat_moveTheCurrentCell() {
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();

        ReviewSession advanced = service.advance(id);
        assertThat(advanced.getCurrentCell().getAnalysisTypeId()).isEqualTo("TOO_LATE");

        ReviewSession retreated = service.retreat(id);
        assertThat(retreated.getCurrentCell().key()).isEqualTo(FIRST);
    }

    @Test
    void markCompleted_forwardsTransitionToSessionListener() {
        List<String> published = new ArrayList<>();
        when(eventPublisher.listenerFor(anyString()))
                .thenReturn((cell, transition) -> published.add(transition + ":" + cell.getControlActionId()));
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();

        assertThat(service.markCompleted(id, FIRST)).isTrue();
        assertThat(service.markSkipped(id, new CellKey("CTRL-PF", "CA-PF-9", "TOO_LATE", 0))).isFalse();

        assertThat(published).containsExactly(CoverageTransition.COMPLETED + ":CA-AP-1");
        assertThat(service.summary(id).getCompletedCells()).isEqualTo(1);
    }

    @Test
    void addInstance_withoutKey_usesCurrentCell() {
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();

        CoverageCell added = service.addInstance(id, null);

        assertThat(added.key()).isEqualTo(FIRST.withInstance(1));
        assertThat(service.getSession(id).getCurrentCell().key()).isEqualTo(FIRST.withInstance(1));
        assertThat(service.cells(id)).hasSize(7);
    }

    @Test
    void updateSnapshot_rescopesSession() {
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();
        AnalysisSnapshot widened = TestDataFactory.coverageSnapshot();
        widened.getControlActions().add(action("CA-IDLE-1", "CTRL-IDLE", "secure", "cabin"));

        ReviewSession updated = service.updateSnapshot(id, widened);

        assertThat(updated.getSummary().getTotalCells()).isEqualTo(8);
        assertThat(updated.getCurrentCell().key()).isEqualTo(FIRST);
    }

    @Test
    void updateSnapshot_cyclicStructure_throws() {
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();
        AnalysisSnapshot cyclic = TestDataFactory.coverageSnapshot();
        cyclic.getControlPaths().add(path("CP-9", "CTRL-AP", "CTRL-PF"));

        assertThatThrownBy(() -> service.updateSnapshot(id, cyclic)).isInstanceOf(GraphCycleException.class);
        assertThat(service.getSession(id).getSummary().getTotalCells()).isEqualTo(6);
    }

    @Test
    void deleteSession_removesSessionAndUpdatesGauge() {
        String id = open(TestDataFactory.coverageSnapshot(), false).getSessionId();

        assertThat(service.deleteSession(id)).isTrue();

        assertThat(service.getSession(id)).isNull();
        verify(metricsConfig).updateActiveSessions(0);
    }
}
