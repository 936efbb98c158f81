package com.stpa.coverage.engine.coverage;

import com.stpa.coverage.engine.ControllerHierarchy;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CellKey;
import com.stpa.coverage.model.CellState;
import com.stpa.coverage.model.ControllerProgress;
import com.stpa.coverage.model.CoverageCell;
import com.stpa.coverage.model.CoverageSummary;
import com.stpa.coverage.model.Finding;
import com.stpa.coverage.model.Movement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Coverage state and guided traversal for one review session.
 *
 * Every (controller, in-scope action, analysis type) has an instance-0 cell; further
 * instances are created on demand through {@link #addInstance}. Only instance-0 cells
 * count towards {@link #completionRatio()}. All public operations are synchronized so a
 * session has a single logical writer.
 */
public class CoverageTracker {

    private static final Logger log = LoggerFactory.getLogger(CoverageTracker.class);

    private final List<String> analysisTypes;
    private final CoverageListener listener;

    private final Map<CellKey, CellState> states = new HashMap<>();
    // Keyed by the instance-0 key of a cell; absent means only instance 0 exists.
    private final Map<CellKey, Integer> highestInstances = new HashMap<>();

    private AnalysisSnapshot snapshot;
    private TraversalPlan plan;
    private TraversalPosition position;
    private Movement lastMovement;

    public CoverageTracker(AnalysisSnapshot snapshot, ControllerHierarchy hierarchy,
                           List<String> analysisTypes, CoverageListener listener) {
        this.analysisTypes = List.copyOf(analysisTypes);
        this.listener = listener != null ? listener : CoverageListener.NONE;
        this.snapshot = snapshot;
        this.plan = new TraversalPlan(snapshot, hierarchy, this.analysisTypes);
        this.position = plan.first();
        this.lastMovement = position != null ? Movement.INITIAL : null;
    }

    /** Cell at the current position, or {@code null} once the traversal is terminal. */
    public synchronized CoverageCell currentCell() {
        return position == null ? null : cellAt(plan.keyOf(position));
    }

    public synchronized CoverageCell advance() {
        if (position == null) {
            return null;
        }
        TraversalPosition next = plan.next(position, this::highestInstance);
        Movement movement = plan.movementBetween(position, next);
        if (movement != null) {
            lastMovement = movement;
            log.debug("Traversal moved {} from {} to {}", movement, position.controllerId(), next.controllerId());
        }
        position = next;
        if (position == null) {
            log.info("Coverage traversal reached the end of the last controller");
        }
        return currentCell();
    }

    public synchronized CoverageCell retreat() {
        TraversalPosition previous = position == null
                ? plan.last(this::highestInstance)
                : plan.previous(position, this::highestInstance);
        if (position != null && previous != null) {
            Movement movement = plan.movementBetween(position, previous);
            if (movement != null) {
                lastMovement = movement;
                log.debug("Traversal moved back {} from {} to {}", movement, position.controllerId(),
                        previous.controllerId());
            }
        }
        position = previous;
        return currentCell();
    }

    /** Adds an instance to the current cell. Returns {@code null} when terminal. */
    public synchronized CoverageCell addInstance() {
        if (position == null) {
            log.warn("addInstance ignored: traversal is terminal");
            return null;
        }
        return addInstance(plan.keyOf(position));
    }

    /**
     * Creates the next instance of the cell identified by {@code key} (any instance of it),
     * leaves it UNVISITED and moves the traversal onto it.
     *
     * @return the new cell, or {@code null} when the cell is not in scope
     */
    public synchronized CoverageCell addInstance(CellKey key) {
        if (!plan.contains(key)) {
            log.warn("addInstance ignored for out-of-scope cell {}", key);
            return null;
        }
        CellKey base = key.withInstance(0);
        int instance = highestInstance(base) + 1;
        highestInstances.put(base, instance);
        CellKey created = base.withInstance(instance);
        states.put(created, CellState.UNVISITED);
        position = plan.positionOf(created);

        CoverageCell cell = cellAt(created);
        listener.onTransition(cell, CoverageTransition.INSTANCE_ADDED);
        return cell;
    }

    public synchronized boolean markCompleted(CellKey key) {
        return mark(key, CellState.COMPLETED, CoverageTransition.COMPLETED);
    }

    public synchronized boolean markSkipped(CellKey key) {
        return mark(key, CellState.SKIPPED, CoverageTransition.SKIPPED);
    }

    private boolean mark(CellKey key, CellState state, CoverageTransition transition) {
        if (!exists(key)) {
            log.warn("Ignoring {} for cell {}: not an in-scope cell of this session", transition, key);
            return false;
        }
        CellState previous = states.getOrDefault(key, CellState.UNVISITED);
        states.put(key, state);
        if (previous != state) {
            listener.onTransition(cellAt(key), transition);
        }
        return true;
    }

    /** State of an existing cell, or {@code null} when the cell does not exist in scope. */
    public synchronized CellState stateOf(CellKey key) {
        return exists(key) ? states.getOrDefault(key, CellState.UNVISITED) : null;
    }

    public synchronized double completionRatio() {
        int total = plan.totalCells();
        if (total == 0) {
            return 1.0;
        }
        return (double) countTerminalBaseCells() / total;
    }

    public synchronized boolean isTerminal() {
        return position == null;
    }

    /** Last change of controller, including steps back via {@link #retreat()}. */
    public synchronized Movement lastMovement() {
        return lastMovement;
    }

    public synchronized CoverageSummary summary() {
        ControllerHierarchy hierarchy = plan.hierarchy();
        List<ControllerProgress> progress = new ArrayList<>();
        int completed = 0;
        int skipped = 0;

        for (String controllerId : plan.controllers()) {
            int controllerTotal = plan.actionsOf(controllerId).size() * analysisTypes.size();
            int controllerCompleted = 0;
            int controllerSkipped = 0;
            for (Map.Entry<CellKey, CellState> entry : states.entrySet()) {
                CellKey key = entry.getKey();
                if (key.instanceIndex() != 0 || !key.controllerId().equals(controllerId) || !plan.contains(key)) {
                    continue;
                }
                if (entry.getValue() == CellState.COMPLETED) controllerCompleted++;
                if (entry.getValue() == CellState.SKIPPED) controllerSkipped++;
            }
            completed += controllerCompleted;
            skipped += controllerSkipped;
            progress.add(ControllerProgress.builder()
                    .controllerId(controllerId)
                    .hierarchyLevel(hierarchy.levelOf(controllerId))
                    .totalCells(controllerTotal)
                    .completedCells(controllerCompleted)
                    .skippedCells(controllerSkipped)
                    .completionRatio(controllerTotal == 0 ? 1.0
                            : (double) (controllerCompleted + controllerSkipped) / controllerTotal)
                    .build());
        }

        int bonus = (int) states.entrySet().stream()
                .filter(e -> e.getKey().instanceIndex() > 0 && plan.contains(e.getKey()))
                .filter(e -> e.getValue().isTerminal())
                .count();

        int total = plan.totalCells();
        return CoverageSummary.builder()
                .totalCells(total)
                .completedCells(completed)
                .skippedCells(skipped)
                .bonusInstances(bonus)
                .completionRatio(total == 0 ? 1.0 : (double) (completed + skipped) / total)
                .terminal(position == null)
                .controllers(progress)
                .build();
    }

    /** Every existing in-scope cell, instances included, in traversal order. */
    public synchronized List<CoverageCell> cells() {
        List<CoverageCell> cells = new ArrayList<>(plan.totalCells());
        for (String controllerId : plan.controllers()) {
            for (String actionId : plan.actionsOf(controllerId)) {
                for (String type : analysisTypes) {
                    CellKey base = new CellKey(controllerId, actionId, type, 0);
                    int highest = highestInstance(base);
                    for (int instance = 0; instance <= highest; instance++) {
                        cells.add(cellAt(base.withInstance(instance)));
                    }
                }
            }
        }
        return Collections.unmodifiableList(cells);
    }

    /**
     * Rebuilds the traversal after a scope change. Recorded states are kept, so a cell that
     * returns to scope comes back with its previous state. When the current cell left scope
     * the traversal restarts at the first cell.
     */
    public synchronized void updateSnapshot(AnalysisSnapshot updated, ControllerHierarchy hierarchy) {
        CellKey current = position == null ? null : plan.keyOf(position);
        this.snapshot = updated;
        this.plan = new TraversalPlan(updated, hierarchy, analysisTypes);

        if (current == null) {
            log.info("Scope updated on a terminal session: {} cells in scope", plan.totalCells());
            return;
        }
        if (exists(current)) {
            position = plan.positionOf(current);
        } else {
            log.info("Current cell {} left scope; restarting traversal at the first cell", current);
            position = plan.first();
            lastMovement = position != null ? Movement.INITIAL : null;
        }
    }

    /**
     * Marks one COMPLETED instance per existing finding of the snapshot, in finding id order.
     * Findings for cells outside the session scope are ignored. No transitions are emitted.
     *
     * @return number of cells seeded
     */
    public synchronized int seedFromFindings() {
        List<Finding> findings = new ArrayList<>(snapshot.safeFindings());
        findings.sort(Comparator.comparing(Finding::getId, Comparator.nullsLast(Comparator.naturalOrder())));

        Map<CellKey, Integer> seededPerCell = new HashMap<>();
        int seeded = 0;
        for (Finding finding : findings) {
            CellKey base = new CellKey(finding.getControllerId(), finding.getControlActionId(),
                    finding.getAnalysisTypeId(), 0);
            if (finding.getControllerId() == null || finding.getControlActionId() == null
                    || finding.getAnalysisTypeId() == null || !plan.contains(base)) {
                log.debug("Finding {} does not map to an in-scope cell, not seeded", finding.getId());
                continue;
            }
            int instance = seededPerCell.merge(base, 1, Integer::sum) - 1;
            if (instance > highestInstance(base)) {
                highestInstances.put(base, instance);
            }
            states.put(base.withInstance(instance), CellState.COMPLETED);
            seeded++;
        }
        log.info("Seeded {} coverage cell(s) from {} existing finding(s)", seeded, findings.size());
        return seeded;
    }

    private boolean exists(CellKey key) {
        return plan.contains(key) && key.instanceIndex() <= highestInstance(key);
    }

    private int highestInstance(CellKey key) {
        return highestInstances.getOrDefault(key.withInstance(0), 0);
    }

    private long countTerminalBaseCells() {
        return states.entrySet().stream()
                .filter(e -> e.getKey().instanceIndex() == 0)
                .filter(e -> plan.contains(e.getKey()))
                .filter(e -> e.getValue().isTerminal())
                .count();
    }

    private CoverageCell cellAt(CellKey key) {
        return CoverageCell.of(key, states.getOrDefault(key, CellState.UNVISITED),
                plan.hierarchy().levelOf(key.controllerId()));
    }
}
