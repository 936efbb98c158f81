package com.stpa.coverage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.ControlAction;
import com.stpa.coverage.model.ControlPath;
import com.stpa.coverage.model.Controller;
import com.stpa.coverage.model.Finding;
import com.stpa.coverage.model.GenerationOptions;
import com.stpa.coverage.model.RecordedCombination;
import com.stpa.coverage.model.TeamRole;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * SHA-256 over the canonical JSON of a snapshot plus the options and scoring weights that
 * shape its ranking. List order in the snapshot does not affect the fingerprint.
 */
@Component
public class SnapshotFingerprint {

    private static final Comparator<String> IDS = Comparator.nullsFirst(Comparator.naturalOrder());

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    public String of(AnalysisSnapshot snapshot, GenerationOptions options, AnalysisConfig.ScoringWeights weights) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("snapshot", canonical(snapshot));
        payload.put("options", options);
        payload.put("weights", weights);

        try {
            byte[] json = canonicalMapper.writeValueAsBytes(payload);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Same content as the input with every list sorted by id. */
    AnalysisSnapshot canonical(AnalysisSnapshot snapshot) {
        List<Controller> controllers = sorted(snapshot.getControllers(), Controller::getId).stream()
                .map(c -> Controller.builder()
                        .id(c.getId())
                        .name(c.getName())
                        .type(c.getType())
                        .teamId(c.getTeamId())
                        .roles(sorted(c.getRoles(), TeamRole::getId))
                        .build())
                .collect(Collectors.toList());

        return AnalysisSnapshot.builder()
                .controllers(controllers)
                .controlActions(sorted(snapshot.getControlActions(), ControlAction::getId))
                .controlPaths(sorted(snapshot.getControlPaths(), ControlPath::getId))
                .findings(sorted(snapshot.getFindings(), Finding::getId))
                .recordedCombinations(sorted(snapshot.getRecordedCombinations(), RecordedCombination::getId).stream()
                        .map(r -> RecordedCombination.builder()
                                .id(r.getId())
                                .actionIds(r.getActionIds() == null ? null
                                        : r.getActionIds().stream().sorted().collect(Collectors.toList()))
                                .type(r.getType())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private static <T> List<T> sorted(List<T> items, Function<T, String> id) {
        if (items == null) return new ArrayList<>();
        List<T> copy = new ArrayList<>(items);
        copy.sort(Comparator.comparing(id, IDS));
        return copy;
    }
}
