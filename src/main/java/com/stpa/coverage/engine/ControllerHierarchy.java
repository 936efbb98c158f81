package com.stpa.coverage.engine;

import com.stpa.coverage.model.ControllerStep;
import com.stpa.coverage.model.Movement;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of {@link HierarchyBuilder}: per-controller levels, the lateral order
 * within each level and the flattened bottom-up, left-to-right visiting sequence.
 */
public final class ControllerHierarchy {

    private final Map<String, Integer> levels;
    private final List<List<String>> controllersByLevel;
    private final List<String> visitingOrder;
    private final Map<String, Integer> positions;

    ControllerHierarchy(Map<String, Integer> levels, List<List<String>> controllersByLevel) {
        this.levels = Map.copyOf(levels);
        this.controllersByLevel = controllersByLevel.stream().map(List::copyOf).toList();
        this.visitingOrder = this.controllersByLevel.stream().flatMap(List::stream).toList();

        Map<String, Integer> pos = new HashMap<>();
        for (int i = 0; i < visitingOrder.size(); i++) {
            pos.put(visitingOrder.get(i), i);
        }
        this.positions = Collections.unmodifiableMap(pos);
    }

    /** Hierarchy level of the controller, or -1 when it is not part of the hierarchy. */
    public int levelOf(String controllerId) {
        return levels.getOrDefault(controllerId, -1);
    }

    public int maxLevel() {
        return controllersByLevel.size() - 1;
    }

    /** Controllers at the level in lateral (left-to-right) order; empty for unknown levels. */
    public List<String> controllersAtLevel(int level) {
        if (level < 0 || level >= controllersByLevel.size()) return Collections.emptyList();
        return controllersByLevel.get(level);
    }

    /** All levels bottom-up, each in lateral order. */
    public List<List<String>> levels() {
        return controllersByLevel;
    }

    public List<String> visitingOrder() {
        return visitingOrder;
    }

    public boolean contains(String controllerId) {
        return positions.containsKey(controllerId);
    }

    public int positionOf(String controllerId) {
        return positions.getOrDefault(controllerId, -1);
    }

    /**
     * Next controller in the visiting sequence. {@code null} as input yields the first
     * controller; the last controller (or an unknown one) yields {@code null}.
     */
    public ControllerStep nextController(String currentControllerId) {
        if (visitingOrder.isEmpty()) return null;
        if (currentControllerId == null) {
            return new ControllerStep(visitingOrder.get(0), Movement.INITIAL);
        }
        Integer index = positions.get(currentControllerId);
        if (index == null || index == visitingOrder.size() - 1) {
            return null;
        }
        String next = visitingOrder.get(index + 1);
        Movement movement = levelOf(next) == levelOf(currentControllerId) ? Movement.LATERAL : Movement.UPWARD;
        return new ControllerStep(next, movement);
    }

    /** Inverse of {@link #nextController(String)}; {@code null} before the first controller. */
    public String previousController(String currentControllerId) {
        Integer index = positions.get(currentControllerId);
        if (index == null || index == 0) return null;
        return visitingOrder.get(index - 1);
    }
}
