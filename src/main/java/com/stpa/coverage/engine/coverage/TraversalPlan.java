package com.stpa.coverage.engine.coverage;

import com.stpa.coverage.engine.ControllerHierarchy;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CellKey;
import com.stpa.coverage.model.ControlAction;
import com.stpa.coverage.model.ControllerStep;
import com.stpa.coverage.model.Movement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Immutable cell order for a guided review and the pure transition functions over it.
 *
 * Order: controllers in hierarchy visiting order (controllers without in-scope actions are
 * passed over), in-scope actions of each controller by id, analysis types in configured
 * order, then existing instances of the cell. Instance counts are owned by the caller and
 * supplied through {@code highestInstance}.
 */
public final class TraversalPlan {

    private final ControllerHierarchy hierarchy;
    private final List<String> analysisTypes;
    private final List<String> controllers;
    private final Map<String, List<String>> actionsByController;
    private final Map<String, String> controllerByAction;
    private final Map<String, Integer> controllerIndex;

    public TraversalPlan(AnalysisSnapshot snapshot, ControllerHierarchy hierarchy, List<String> analysisTypes) {
        this.hierarchy = hierarchy;
        this.analysisTypes = List.copyOf(analysisTypes);

        Map<String, List<String>> grouped = new HashMap<>();
        Map<String, String> owners = new HashMap<>();
        for (ControlAction action : snapshot.inScopeActions()) {
            grouped.computeIfAbsent(action.getControllerId(), k -> new ArrayList<>()).add(action.getId());
            owners.put(action.getId(), action.getControllerId());
        }

        List<String> ordered = hierarchy.visitingOrder().stream()
                .filter(grouped::containsKey)
                .collect(Collectors.toList());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            index.put(ordered.get(i), i);
        }

        Map<String, List<String>> frozen = new HashMap<>();
        grouped.forEach((controller, actions) -> frozen.put(controller, List.copyOf(actions)));

        this.controllers = List.copyOf(ordered);
        this.actionsByController = Collections.unmodifiableMap(frozen);
        this.controllerByAction = Collections.unmodifiableMap(owners);
        this.controllerIndex = Collections.unmodifiableMap(index);
    }

    public List<String> controllers() {
        return controllers;
    }

    public List<String> actionsOf(String controllerId) {
        return actionsByController.getOrDefault(controllerId, Collections.emptyList());
    }

    public List<String> analysisTypes() {
        return analysisTypes;
    }

    public ControllerHierarchy hierarchy() {
        return hierarchy;
    }

    /** In-scope controllers x in-scope actions x analysis types. */
    public int totalCells() {
        int actions = actionsByController.values().stream().mapToInt(List::size).sum();
        return actions * analysisTypes.size();
    }

    public boolean isEmpty() {
        return controllers.isEmpty() || analysisTypes.isEmpty();
    }

    /** Whether the cell's controller, action and analysis type are all in scope. */
    public boolean contains(CellKey key) {
        if (key == null || key.instanceIndex() < 0) return false;
        String owner = controllerByAction.get(key.controlActionId());
        return owner != null && owner.equals(key.controllerId()) && analysisTypes.contains(key.analysisTypeId());
    }

    public CellKey keyOf(TraversalPosition position) {
        return new CellKey(position.controllerId(), position.controlActionId(),
                analysisTypes.get(position.typeIndex()), position.instanceIndex());
    }

    public TraversalPosition positionOf(CellKey key) {
        if (!contains(key)) return null;
        return new TraversalPosition(key.controllerId(), key.controlActionId(),
                analysisTypes.indexOf(key.analysisTypeId()), key.instanceIndex());
    }

    public TraversalPosition first() {
        if (isEmpty()) return null;
        String controller = controllers.get(0);
        return new TraversalPosition(controller, actionsOf(controller).get(0), 0, 0);
    }

    public TraversalPosition last(ToIntFunction<CellKey> highestInstance) {
        if (isEmpty()) return null;
        String controller = controllers.get(controllers.size() - 1);
        List<String> actions = actionsOf(controller);
        TraversalPosition base = new TraversalPosition(controller, actions.get(actions.size() - 1),
                analysisTypes.size() - 1, 0);
        return base.withInstance(highestInstance.applyAsInt(keyOf(base)));
    }

    /**
     * Next instance of the same cell, else next analysis type, else next action of the
     * controller, else first cell of the next controller; {@code null} past the last cell.
     */
    public TraversalPosition next(TraversalPosition position, ToIntFunction<CellKey> highestInstance) {
        if (position.instanceIndex() < highestInstance.applyAsInt(keyOf(position))) {
            return position.withInstance(position.instanceIndex() + 1);
        }
        if (position.typeIndex() + 1 < analysisTypes.size()) {
            return new TraversalPosition(position.controllerId(), position.controlActionId(),
                    position.typeIndex() + 1, 0);
        }
        List<String> actions = actionsOf(position.controllerId());
        int actionIndex = actions.indexOf(position.controlActionId());
        if (actionIndex >= 0 && actionIndex + 1 < actions.size()) {
            return new TraversalPosition(position.controllerId(), actions.get(actionIndex + 1), 0, 0);
        }
        String nextController = nextControllerAfter(position.controllerId());
        if (nextController == null) {
            return null;
        }
        return new TraversalPosition(nextController, actionsOf(nextController).get(0), 0, 0);
    }

    /**
     * Exact inverse of {@link #next}. At the first cell the position is returned unchanged.
     */
    public TraversalPosition previous(TraversalPosition position, ToIntFunction<CellKey> highestInstance) {
        if (position.instanceIndex() > 0) {
            return position.withInstance(position.instanceIndex() - 1);
        }
        if (position.typeIndex() > 0) {
            TraversalPosition base = new TraversalPosition(position.controllerId(), position.controlActionId(),
                    position.typeIndex() - 1, 0);
            return base.withInstance(highestInstance.applyAsInt(keyOf(base)));
        }
        List<String> actions = actionsOf(position.controllerId());
        int actionIndex = actions.indexOf(position.controlActionId());
        String controller = position.controllerId();
        String action;
        if (actionIndex > 0) {
            action = actions.get(actionIndex - 1);
        } else {
            Integer index = controllerIndex.get(controller);
            if (index == null || index == 0) {
                return position;
            }
            controller = controllers.get(index - 1);
            List<String> previousActions = actionsOf(controller);
            action = previousActions.get(previousActions.size() - 1);
        }
        TraversalPosition base = new TraversalPosition(controller, action, analysisTypes.size() - 1, 0);
        return base.withInstance(highestInstance.applyAsInt(keyOf(base)));
    }

    /** How the traversal moved between two positions; {@code null} within one controller. */
    public Movement movementBetween(TraversalPosition from, TraversalPosition to) {
        if (to == null) return null;
        if (from == null) return Movement.INITIAL;
        if (from.controllerId().equals(to.controllerId())) return null;
        int fromLevel = hierarchy.levelOf(from.controllerId());
        int toLevel = hierarchy.levelOf(to.controllerId());
        if (fromLevel == toLevel) return Movement.LATERAL;
        return toLevel > fromLevel ? Movement.UPWARD : Movement.DOWNWARD;
    }

    /**
     * Walks {@link ControllerHierarchy#nextController} until a controller with in-scope actions appears.
     */
    private String nextControllerAfter(String controllerId) {
        ControllerStep step = hierarchy.nextController(controllerId);
        while (step != null && !actionsByController.containsKey(step.controllerId())) {
            step = hierarchy.nextController(step.controllerId());
        }
        return step == null ? null : step.controllerId();
    }
}
