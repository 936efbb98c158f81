package com.stpa.coverage.engine;

import com.stpa.coverage.exception.InvalidConfigurationException;
import com.stpa.coverage.model.*;
import com.stpa.coverage.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.stpa.coverage.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CombinationGeneratorTest {

    private final CombinationGenerator generator = new CombinationGenerator();

    @Test
    void generate_threeControllersMaxTwo_yieldsThreePairsPerType() {
        List<CandidateCombination> candidates =
                generator.generate(TestDataFactory.threeControllerSnapshot(), options(2, true, false));

        assertThat(candidates).hasSize(3);
        assertThat(candidates).extracting(CandidateCombination::getControllerIds).containsExactly(
                List.of("CTRL-A", "CTRL-B"), List.of("CTRL-A", "CTRL-C"), List.of("CTRL-B", "CTRL-C"));
        assertThat(candidates).allSatisfy(c -> {
            assertThat(c.getType()).isEqualTo(CombinationType.CO_OCCURRENCE);
            assertThat(c.getAbstraction()).isEqualTo(AbstractionLevel.CROSS_CONTROLLER);
        });
    }

    @Test
    void generate_threeControllersMaxThree_addsTheTriple() {
        List<CandidateCombination> candidates =
                generator.generate(TestDataFactory.threeControllerSnapshot(), options(3, true, false));

        assertThat(candidates).hasSize(4);
        assertThat(candidates.get(3).getActionIds()).containsExactly("CA-A-1", "CA-B-1", "CA-C-1");
        assertThat(candidates.get(3).size()).isEqualTo(3);
    }

    @Test
    void generate_bothTypes_emitsCoOccurrenceThenTemporalPerSubset() {
        List<CandidateCombination> candidates =
                generator.generate(TestDataFactory.threeControllerSnapshot(), options(2, true, true));

        assertThat(candidates).hasSize(6);
        assertThat(candidates.get(0).getType()).isEqualTo(CombinationType.CO_OCCURRENCE);
        assertThat(candidates.get(1).getType()).isEqualTo(CombinationType.TEMPORAL_ORDERING);
        assertThat(candidates.get(0).getActionIds()).isEqualTo(candidates.get(1).getActionIds());
        assertThat(candidates.stream().map(CandidateCombination::getSignature).distinct()).hasSize(6);
    }

    @Test
    void generate_dropsSubsetsFromASingleController() {
        AnalysisSnapshot snapshot = snapshot(
                List.of(controller("CTRL-A", "A", ControllerType.HUMAN),
                        controller("CTRL-B", "B", ControllerType.SOFTWARE)),
                List.of(action("CA-A-1", "CTRL-A", "open", "valve"),
                        action("CA-A-2", "CTRL-A", "close", "valve"),
                        action("CA-B-1", "CTRL-B", "start", "pump")),
                List.of(), List.of());

        List<CandidateCombination> candidates = generator.generate(snapshot, options(2, true, false));

        assertThat(candidates).extracting(CandidateCombination::getActionIds)
                .containsExactly(List.of("CA-A-1", "CA-B-1"), List.of("CA-A-2", "CA-B-1"));
        assertThat(candidates).allSatisfy(c -> assertThat(c.distinctControllers()).hasSizeGreaterThanOrEqualTo(2));
    }

    @Test
    void generate_ignoresOutOfScopeAndOrphanActions() {
        AnalysisSnapshot snapshot = TestDataFactory.threeControllerSnapshot();
        snapshot.getControlActions().add(outOfScopeAction("CA-A-9", "CTRL-A"));
        snapshot.getControlActions().add(action("CA-X-1", "CTRL-GHOST", "do", "thing"));

        List<CandidateCombination> candidates = generator.generate(snapshot, options(3, true, false));

        assertThat(candidates).hasSize(4);
        assertThat(candidates).flatExtracting(CandidateCombination::getActionIds)
                .doesNotContain("CA-A-9", "CA-X-1");
    }

    @Test
    void generate_fewerThanTwoControllers_returnsEmptyWithoutValidating() {
        AnalysisSnapshot snapshot = snapshot(
                List.of(controller("CTRL-A", "A", ControllerType.HUMAN),
                        controller("CTRL-B", "B", ControllerType.SOFTWARE)),
                List.of(action("CA-A-1", "CTRL-A", "open", "valve"),
                        outOfScopeAction("CA-B-1", "CTRL-B")),
                List.of(), List.of());

        assertThat(generator.generate(snapshot, options(5, true, true))).isEmpty();
        assertThat(generator.countInScopeControllers(snapshot)).isEqualTo(1);
    }

    @Test
    void generate_maxSizeAboveControllerCount_throws() {
        assertThatThrownBy(() -> generator.generate(TestDataFactory.threeControllerSnapshot(), options(4, true, false)))
                .isInstanceOf(InvalidConfigurationException.class)
                .satisfies(e -> assertThat(((InvalidConfigurationException) e).getField())
                        .isEqualTo("maxCombinationSize"));
    }

    @Test
    void generate_maxSizeBelowTwo_throws() {
        assertThatThrownBy(() -> generator.generate(TestDataFactory.threeControllerSnapshot(), options(1, true, false)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining(">= 2");
    }

    @Test
    void generate_noTypeEnabled_throws() {
        assertThatThrownBy(() -> generator.generate(TestDataFactory.threeControllerSnapshot(), options(2, false, false)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("combination type");
    }

    @Test
    void generate_teamMembers_areSameTeamAndCanBeExcluded() {
        AnalysisSnapshot snapshot = snapshot(
                List.of(team("CTRL-CREW", "Flight Crew", "Pilot Flying", "Pilot Monitoring"),
                        member("CTRL-PF", "Pilot Flying", ControllerType.HUMAN, "CTRL-CREW"),
                        controller("CTRL-AP", "Autopilot", ControllerType.SOFTWARE)),
                List.of(action("CA-CREW-1", "CTRL-CREW", "brief", "approach"),
                        action("CA-PF-1", "CTRL-PF", "adjust", "pitch"),
                        action("CA-AP-1", "CTRL-AP", "engage", "altitude hold")),
                List.of(), List.of());

        List<CandidateCombination> all = generator.generate(snapshot, options(2, true, false));
        assertThat(all).filteredOn(c -> c.getAbstraction() == AbstractionLevel.SAME_TEAM)
                .extracting(CandidateCombination::getControllerIds)
                .containsExactly(List.of("CTRL-CREW", "CTRL-PF"));

        GenerationOptions crossOnly = options(2, true, false).toBuilder().includeSameTeamAbstraction(false).build();
        assertThat(generator.generate(snapshot, crossOnly))
                .hasSize(2)
                .allSatisfy(c -> assertThat(c.getAbstraction()).isEqualTo(AbstractionLevel.CROSS_CONTROLLER));
    }

    @Test
    void generate_describesControllersAndActions() {
        CandidateCombination first =
                generator.generate(TestDataFactory.threeControllerSnapshot(), options(2, true, true)).get(0);
        CandidateCombination temporal =
                generator.generate(TestDataFactory.threeControllerSnapshot(), options(2, true, true)).get(1);

        assertThat(first.getDescription())
                .isEqualTo("Pilot Flying [adjust pitch] and Autopilot [engage altitude hold] provided or withheld concurrently");
        assertThat(temporal.getDescription()).endsWith("provided in an unsafe order or timing");
        assertThat(first.getSignature())
                .isEqualTo("CTRL-A,CTRL-B|CA-A-1,CA-B-1|CO_OCCURRENCE|CROSS_CONTROLLER");
    }

    @Test
    void stream_isLazyAndRepeatable() {
        AnalysisSnapshot snapshot = TestDataFactory.threeControllerSnapshot();

        List<String> firstRun = generator.stream(snapshot, options(3, true, true))
                .map(CandidateCombination::getSignature).collect(Collectors.toList());
        List<String> secondRun = generator.stream(snapshot, options(3, true, true))
                .map(CandidateCombination::getSignature).collect(Collectors.toList());

        assertThat(firstRun).isEqualTo(secondRun);
        assertThat(generator.stream(snapshot, options(3, true, true)).limit(1).count()).isEqualTo(1);
    }
}
