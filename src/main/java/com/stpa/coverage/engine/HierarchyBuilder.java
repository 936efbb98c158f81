package com.stpa.coverage.engine;

import com.stpa.coverage.exception.GraphCycleException;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.ControlPath;
import com.stpa.coverage.model.Controller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assigns hierarchy levels to controllers and derives a deterministic visiting order.
 *
 * Level: longest path from the controller down to a controller that controls no other
 * controller (level 0). Edges to non-controller components do not count.
 *
 * Lateral order: levels are ranked top-down. Within a level, controllers are ordered by
 * the rank of their earliest governing parent (controllers without a controlling parent
 * first), then by id. Parents always sit on a higher level, so their rank is known.
 *
 * The visiting order walks levels bottom-up, each level left to right.
 */
@Component
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    public ControllerHierarchy build(AnalysisSnapshot snapshot) {
        Map<String, Controller> controllers = new TreeMap<>(snapshot.controllersById());

        // Adjacency: controller -> controlled controllers, and the reverse
        Map<String, Set<String>> children = new HashMap<>();
        Map<String, Set<String>> parents = new HashMap<>();
        for (String id : controllers.keySet()) {
            children.put(id, new TreeSet<>());
            parents.put(id, new TreeSet<>());
        }

        for (ControlPath path : snapshot.safeControlPaths()) {
            String source = path.getSourceControllerId();
            String target = path.getTargetId();
            if (!controllers.containsKey(source)) {
                log.warn("Ignoring control path {}: unknown source controller {}", path.getId(), source);
                continue;
            }
            if (!controllers.containsKey(target)) {
                continue; // controlled component, not a controller
            }
            children.get(source).add(target);
            parents.get(target).add(source);
        }

        List<String> topological = topologicalOrder(controllers.keySet(), children, parents);

        // Longest path to a leaf: resolve children before parents
        Map<String, Integer> levels = new HashMap<>();
        int maxLevel = 0;
        for (int i = topological.size() - 1; i >= 0; i--) {
            String id = topological.get(i);
            int level = 0;
            for (String child : children.get(id)) {
                level = Math.max(level, levels.get(child) + 1);
            }
            levels.put(id, level);
            maxLevel = Math.max(maxLevel, level);
        }

        List<List<String>> byLevel = new ArrayList<>();
        for (int l = 0; l <= maxLevel; l++) {
            byLevel.add(new ArrayList<>());
        }
        for (String id : controllers.keySet()) {
            byLevel.get(levels.get(id)).add(id);
        }

        // Rank levels top-down so every parent is ranked before its children
        Map<String, Integer> rank = new HashMap<>();
        int nextRank = 0;
        for (int l = maxLevel; l >= 0; l--) {
            List<String> atLevel = byLevel.get(l);
            atLevel.sort(Comparator
                    .comparingInt((String id) -> governingParentRank(id, parents, rank))
                    .thenComparing(Comparator.naturalOrder()));
            for (String id : atLevel) {
                rank.put(id, nextRank++);
            }
        }

        if (controllers.isEmpty()) {
            byLevel.clear();
        }

        log.debug("Built controller hierarchy: {} controllers over {} level(s)",
                controllers.size(), byLevel.size());
        return new ControllerHierarchy(levels, byLevel);
    }

    private int governingParentRank(String id, Map<String, Set<String>> parents, Map<String, Integer> rank) {
        int best = -1;
        for (String parent : parents.get(id)) {
            int r = rank.getOrDefault(parent, Integer.MAX_VALUE);
            best = best < 0 ? r : Math.min(best, r);
        }
        return best;
    }

    /**
     * Kahn's algorithm over controller edges. Anything left unprocessed lies on or behind a cycle.
     */
    private List<String> topologicalOrder(Set<String> ids,
                                          Map<String, Set<String>> children,
                                          Map<String, Set<String>> parents) {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : ids) {
            int degree = parents.get(id).size();
            inDegree.put(id, degree);
            if (degree == 0) ready.add(id);
        }

        List<String> order = new ArrayList<>(ids.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String child : children.get(id)) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) ready.add(child);
            }
        }

        if (order.size() < ids.size()) {
            List<String> stuck = new ArrayList<>();
            for (String id : ids) {
                if (inDegree.get(id) > 0) stuck.add(id);
            }
            log.warn("Control structure cycle detected among controllers {}", stuck);
            throw new GraphCycleException(stuck);
        }
        return order;
    }
}
