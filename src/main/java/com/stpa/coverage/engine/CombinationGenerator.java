package com.stpa.coverage.engine;

import com.stpa.coverage.exception.InvalidConfigurationException;
import com.stpa.coverage.model.AbstractionLevel;
import com.stpa.coverage.model.ActionRef;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CandidateCombination;
import com.stpa.coverage.model.CombinationType;
import com.stpa.coverage.model.ControlAction;
import com.stpa.coverage.model.Controller;
import com.stpa.coverage.model.ControllerType;
import com.stpa.coverage.model.GenerationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates candidate combinations of in-scope control actions.
 *
 * Actions are sorted by (controllerId, actionId) and subsets of size 2..maxSize are walked
 * through {@link IndexSubsets}, so candidates are produced lazily and in an order that
 * depends only on snapshot content. Subsets drawn from a single controller are dropped.
 * Each eligible subset yields one candidate per enabled {@link CombinationType}.
 */
@Component
public class CombinationGenerator {

    private static final Logger log = LoggerFactory.getLogger(CombinationGenerator.class);

    /** Materialized form of {@link #stream}. */
    public List<CandidateCombination> generate(AnalysisSnapshot snapshot, GenerationOptions options) {
        try (Stream<CandidateCombination> candidates = stream(snapshot, options)) {
            return candidates.collect(Collectors.toList());
        }
    }

    /**
     * Lazy candidate sequence. Returns an empty stream when fewer than two controllers own
     * in-scope actions.
     *
     * @throws InvalidConfigurationException when the options cannot produce a valid enumeration
     */
    public Stream<CandidateCombination> stream(AnalysisSnapshot snapshot, GenerationOptions options) {
        List<ControlAction> actions = snapshot.inScopeActions();
        int controllerCount = countControllers(actions);

        if (controllerCount < 2) {
            log.info("Skipping combination generation: {} in-scope controller(s), at least 2 required",
                    controllerCount);
            return Stream.empty();
        }
        validate(options, controllerCount);

        Map<String, Controller> controllers = snapshot.controllersById();
        IndexSubsets subsets = new IndexSubsets(actions.size(), 2, options.getMaxCombinationSize());
        log.debug("Enumerating up to {} action subsets over {} actions / {} controllers",
                subsets.size(), actions.size(), controllerCount);

        return StreamSupport.stream(subsets.spliterator(), false)
                .map(indices -> pick(actions, indices))
                .filter(subset -> countControllers(subset) >= 2)
                .flatMap(subset -> candidatesFor(subset, controllers, options));
    }

    public int countInScopeControllers(AnalysisSnapshot snapshot) {
        return countControllers(snapshot.inScopeActions());
    }

    void validate(GenerationOptions options, int controllerCount) {
        int max = options.getMaxCombinationSize();
        if (max < 2) {
            throw new InvalidConfigurationException("maxCombinationSize",
                    "maxCombinationSize must be >= 2, was " + max);
        }
        if (max > controllerCount) {
            throw new InvalidConfigurationException("maxCombinationSize",
                    "maxCombinationSize must be <= number of in-scope controllers (" + controllerCount + "), was " + max);
        }
        if (!options.isIncludeCoOccurrenceType() && !options.isIncludeTemporalOrderingType()) {
            throw new InvalidConfigurationException("includeCoOccurrenceType",
                    "At least one combination type must be enabled");
        }
        if (!options.isIncludeSameTeamAbstraction() && !options.isIncludeCrossControllerAbstraction()) {
            throw new InvalidConfigurationException("includeCrossControllerAbstraction",
                    "At least one abstraction level must be enabled");
        }
    }

    private Stream<CandidateCombination> candidatesFor(List<ControlAction> subset,
                                                       Map<String, Controller> controllers,
                                                       GenerationOptions options) {
        AbstractionLevel abstraction = classify(subset, controllers);
        if (abstraction == AbstractionLevel.SAME_TEAM && !options.isIncludeSameTeamAbstraction()) {
            return Stream.empty();
        }
        if (abstraction == AbstractionLevel.CROSS_CONTROLLER && !options.isIncludeCrossControllerAbstraction()) {
            return Stream.empty();
        }

        List<CandidateCombination> out = new ArrayList<>(2);
        if (options.isIncludeCoOccurrenceType()) {
            out.add(build(subset, controllers, abstraction, CombinationType.CO_OCCURRENCE));
        }
        if (options.isIncludeTemporalOrderingType()) {
            out.add(build(subset, controllers, abstraction, CombinationType.TEMPORAL_ORDERING));
        }
        return out.stream();
    }

    AbstractionLevel classify(List<ControlAction> subset, Map<String, Controller> controllers) {
        String team = null;
        for (ControlAction action : subset) {
            String memberOf = teamOf(controllers.get(action.getControllerId()), controllers);
            if (memberOf == null || (team != null && !team.equals(memberOf))) {
                return AbstractionLevel.CROSS_CONTROLLER;
            }
            team = memberOf;
        }
        return AbstractionLevel.SAME_TEAM;
    }

    /** The TEAM controller a controller belongs to: itself if it is a team, else its declared team. */
    private String teamOf(Controller controller, Map<String, Controller> controllers) {
        if (controller == null) return null;
        if (controller.getType() == ControllerType.TEAM) return controller.getId();
        if (controller.getTeamId() == null) return null;
        Controller team = controllers.get(controller.getTeamId());
        return team != null && team.getType() == ControllerType.TEAM ? team.getId() : null;
    }

    private CandidateCombination build(List<ControlAction> subset, Map<String, Controller> controllers,
                                       AbstractionLevel abstraction, CombinationType type) {
        List<ActionRef> members = subset.stream()
                .map(a -> new ActionRef(a.getControllerId(), a.getId()))
                .collect(Collectors.toList());
        List<String> controllerIds = new ArrayList<>(new TreeSet<>(
                members.stream().map(ActionRef::controllerId).collect(Collectors.toList())));
        List<String> actionIds = members.stream().map(ActionRef::actionId).sorted().collect(Collectors.toList());

        return CandidateCombination.builder()
                .signature(CandidateCombination.signatureOf(controllerIds, actionIds, type, abstraction))
                .controllerIds(Collections.unmodifiableList(controllerIds))
                .actionIds(Collections.unmodifiableList(actionIds))
                .members(Collections.unmodifiableList(members))
                .abstraction(abstraction)
                .type(type)
                .description(describe(subset, controllers, type))
                .build();
    }

    private String describe(List<ControlAction> subset, Map<String, Controller> controllers, CombinationType type) {
        String parts = subset.stream()
                .map(a -> nameOf(controllers.get(a.getControllerId()), a.getControllerId()) + " [" + a.label() + "]")
                .collect(Collectors.joining(" and "));
        return type == CombinationType.CO_OCCURRENCE
                ? parts + " provided or withheld concurrently"
                : parts + " provided in an unsafe order or timing";
    }

    private String nameOf(Controller controller, String fallback) {
        return controller != null && controller.getName() != null ? controller.getName() : fallback;
    }

    private static List<ControlAction> pick(List<ControlAction> actions, int[] indices) {
        List<ControlAction> subset = new ArrayList<>(indices.length);
        for (int index : indices) {
            subset.add(actions.get(index));
        }
        return subset;
    }

    private static int countControllers(List<ControlAction> actions) {
        Set<String> ids = actions.stream()
                .map(ControlAction::getControllerId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return ids.size();
    }
}
