package com.stpa.coverage.engine;

import com.stpa.coverage.model.CandidateCombination;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over scored candidates: highest score first, then the canonical signature
 * (sorted controller ids, then sorted action ids), then type and abstraction.
 */
@Component
public class Prioritizer {

    static final Comparator<List<String>> LEXICOGRAPHIC = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    public static final Comparator<CandidateCombination> PRIORITY_ORDER =
            Comparator.comparingInt(CandidateCombination::getRiskScore).reversed()
                    .thenComparing(CandidateCombination::getControllerIds, LEXICOGRAPHIC)
                    .thenComparing(CandidateCombination::getActionIds, LEXICOGRAPHIC)
                    .thenComparing(CandidateCombination::getType)
                    .thenComparing(CandidateCombination::getAbstraction);

    public List<CandidateCombination> prioritize(List<CandidateCombination> candidates) {
        List<CandidateCombination> sorted = new ArrayList<>(candidates);
        sorted.sort(PRIORITY_ORDER);
        return sorted;
    }
}
