package com.stpa.coverage.engine.coverage;

import com.stpa.coverage.engine.HierarchyBuilder;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CellKey;
import com.stpa.coverage.model.Movement;
import com.stpa.coverage.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

import static com.stpa.coverage.testutil.TestDataFactory.TWO_ANALYSIS_TYPES;
import static org.assertj.core.api.Assertions.assertThat;

class TraversalPlanTest {

    private static final ToIntFunction<CellKey> NO_EXTRA_INSTANCES = key -> 0;

    private TraversalPlan plan;

    @BeforeEach
    void setUp() {
        AnalysisSnapshot snapshot = TestDataFactory.coverageSnapshot();
        plan = new TraversalPlan(snapshot, new HierarchyBuilder().build(snapshot), TWO_ANALYSIS_TYPES);
    }

    @Test
    void plan_skipsControllersWithoutInScopeActions() {
        assertThat(plan.controllers()).containsExactly("CTRL-AP", "CTRL-PF");
        assertThat(plan.actionsOf("CTRL-PF")).containsExactly("CA-PF-1");
        assertThat(plan.actionsOf("CTRL-IDLE")).isEmpty();
        assertThat(plan.totalCells()).isEqualTo(6);
    }

    @Test
    void next_walksTypesThenActionsThenControllers() {
        List<CellKey> visited = new ArrayList<>();
        TraversalPosition position = plan.first();
        while (position != null) {
            visited.add(plan.keyOf(position));
            position = plan.next(position, NO_EXTRA_INSTANCES);
        }

        assertThat(visited).containsExactly(
                new CellKey("CTRL-AP", "CA-AP-1", "NOT_PROVIDED", 0),
                new CellKey("CTRL-AP", "CA-AP-1", "TOO_LATE", 0),
                new CellKey("CTRL-AP", "CA-AP-2", "NOT_PROVIDED", 0),
                new CellKey("CTRL-AP", "CA-AP-2", "TOO_LATE", 0),
                new CellKey("CTRL-PF", "CA-PF-1", "NOT_PROVIDED", 0),
                new CellKey("CTRL-PF", "CA-PF-1", "TOO_LATE", 0));
    }

    @Test
    void next_visitsExistingInstancesBeforeNextType() {
        ToIntFunction<CellKey> twoInstancesOnFirstCell =
                key -> key.sameCell(new CellKey("CTRL-AP", "CA-AP-1", "NOT_PROVIDED", 0)) ? 2 : 0;

        TraversalPosition position = plan.first();
        position = plan.next(position, twoInstancesOnFirstCell);
        assertThat(plan.keyOf(position).instanceIndex()).isEqualTo(1);
        position = plan.next(position, twoInstancesOnFirstCell);
        assertThat(plan.keyOf(position).instanceIndex()).isEqualTo(2);
        position = plan.next(position, twoInstancesOnFirstCell);
        assertThat(plan.keyOf(position)).isEqualTo(new CellKey("CTRL-AP", "CA-AP-1", "TOO_LATE", 0));
    }

    @Test
    void previous_isInverseOfNext() {
        ToIntFunction<CellKey> instances =
                key -> key.sameCell(new CellKey("CTRL-AP", "CA-AP-2", "TOO_LATE", 0)) ? 1 : 0;

        List<TraversalPosition> forward = new ArrayList<>();
        TraversalPosition position = plan.first();
        while (position != null) {
            forward.add(position);
            position = plan.next(position, instances);
        }

        for (int i = forward.size() - 1; i > 0; i--) {
            assertThat(plan.previous(forward.get(i), instances)).isEqualTo(forward.get(i - 1));
        }
        assertThat(plan.last(instances)).isEqualTo(forward.get(forward.size() - 1));
    }

    @Test
    void previous_atFirstCell_staysPut() {
        assertThat(plan.previous(plan.first(), NO_EXTRA_INSTANCES)).isEqualTo(plan.first());
    }

    @Test
    void contains_rejectsOutOfScopeAndMismatchedCells() {
        assertThat(plan.contains(new CellKey("CTRL-PF", "CA-PF-1", "TOO_LATE", 0))).isTrue();
        assertThat(plan.contains(new CellKey("CTRL-PF", "CA-PF-9", "TOO_LATE", 0))).isFalse();
        assertThat(plan.contains(new CellKey("CTRL-AP", "CA-PF-1", "TOO_LATE", 0))).isFalse();
        assertThat(plan.contains(new CellKey("CTRL-PF", "CA-PF-1", "TOO_EARLY", 0))).isFalse();
        assertThat(plan.contains(new CellKey("CTRL-PF", "CA-PF-1", "TOO_LATE", -1))).isFalse();
    }

    @Test
    void movementBetween_reportsControllerChanges() {
        TraversalPosition ap = plan.first();
        TraversalPosition pf = plan.positionOf(new CellKey("CTRL-PF", "CA-PF-1", "NOT_PROVIDED", 0));

        assertThat(plan.movementBetween(null, ap)).isEqualTo(Movement.INITIAL);
        assertThat(plan.movementBetween(ap, pf)).isEqualTo(Movement.UPWARD);
        assertThat(plan.movementBetween(pf, ap)).isEqualTo(Movement.DOWNWARD);
        assertThat(plan.movementBetween(ap, plan.next(ap, NO_EXTRA_INSTANCES))).isNull();
    }

    @Test
    void emptyPlan_hasNoFirstCell() {
        AnalysisSnapshot empty = new AnalysisSnapshot();
        TraversalPlan emptyPlan = new TraversalPlan(empty, new HierarchyBuilder().build(empty), TWO_ANALYSIS_TYPES);

        assertThat(emptyPlan.isEmpty()).isTrue();
        assertThat(emptyPlan.first()).isNull();
        assertThat(emptyPlan.totalCells()).isZero();
    }
}
