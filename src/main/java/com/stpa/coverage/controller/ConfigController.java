package com.stpa.coverage.controller;

import com.stpa.coverage.config.AnalysisConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime analysis configuration")
public class ConfigController {

    private final AnalysisConfig analysisConfig;

    public ConfigController(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    // ── Analysis ──

    @Operation(summary = "Get enumeration and traversal configuration")
    @GetMapping("/analysis")
    public ResponseEntity<Map<String, Object>> getAnalysisConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("maxCombinationSize", analysisConfig.getMaxCombinationSize());
        config.put("includeSameTeamAbstraction", analysisConfig.isIncludeSameTeamAbstraction());
        config.put("includeCrossControllerAbstraction", analysisConfig.isIncludeCrossControllerAbstraction());
        config.put("includeCoOccurrenceType", analysisConfig.isIncludeCoOccurrenceType());
        config.put("includeTemporalOrderingType", analysisConfig.isIncludeTemporalOrderingType());
        config.put("minRiskScore", analysisConfig.getMinRiskScore());
        config.put("analysisTypes", analysisConfig.getAnalysisTypes());
        synchronized (analysisConfig) {
            config.put("excludedSignatures", List.copyOf(analysisConfig.getExcludedSignatures()));
        }
        return ResponseEntity.ok(config);
    }

    @Operation(summary = "Update enumeration and traversal configuration",
            description = "Changes apply immediately but reset on restart. Omitted fields keep their current value.")
    @PutMapping("/analysis")
    public ResponseEntity<?> updateAnalysisConfig(@RequestBody Map<String, Object> body) {
        int maxSize = toInt(body, "maxCombinationSize", analysisConfig.getMaxCombinationSize());
        boolean sameTeam = toBoolean(body, "includeSameTeamAbstraction", analysisConfig.isIncludeSameTeamAbstraction());
        boolean crossController = toBoolean(body, "includeCrossControllerAbstraction",
                analysisConfig.isIncludeCrossControllerAbstraction());
        boolean coOccurrence = toBoolean(body, "includeCoOccurrenceType", analysisConfig.isIncludeCoOccurrenceType());
        boolean temporal = toBoolean(body, "includeTemporalOrderingType", analysisConfig.isIncludeTemporalOrderingType());
        int minRiskScore = toInt(body, "minRiskScore", analysisConfig.getMinRiskScore());

        if (maxSize < 2) return badRequest("maxCombinationSize must be >= 2", "maxCombinationSize");
        if (minRiskScore < 0 || minRiskScore > 100) {
            return badRequest("minRiskScore must be between 0 and 100", "minRiskScore");
        }
        if (!sameTeam && !crossController) {
            return badRequest("At least one abstraction level must be enabled", "includeCrossControllerAbstraction");
        }
        if (!coOccurrence && !temporal) {
            return badRequest("At least one combination type must be enabled", "includeCoOccurrenceType");
        }

        List<String> analysisTypes = analysisConfig.getAnalysisTypes();
        if (body.containsKey("analysisTypes")) {
            Object raw = body.get("analysisTypes");
            if (!(raw instanceof List<?> rawList) || rawList.isEmpty()) {
                return badRequest("analysisTypes must be a non-empty list", "analysisTypes");
            }
            analysisTypes = rawList.stream()
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .distinct()
                    .collect(Collectors.toList());
            if (analysisTypes.isEmpty()) {
                return badRequest("analysisTypes must be a non-empty list", "analysisTypes");
            }
        }

        List<String> excluded = null;
        if (body.containsKey("excludedSignatures")) {
            Object raw = body.get("excludedSignatures");
            if (!(raw instanceof List<?> rawList)) {
                return badRequest("excludedSignatures must be a list", "excludedSignatures");
            }
            excluded = rawList.stream().map(Object::toString).distinct().collect(Collectors.toList());
        }

        analysisConfig.setMaxCombinationSize(maxSize);
        analysisConfig.setIncludeSameTeamAbstraction(sameTeam);
        analysisConfig.setIncludeCrossControllerAbstraction(crossController);
        analysisConfig.setIncludeCoOccurrenceType(coOccurrence);
        analysisConfig.setIncludeTemporalOrderingType(temporal);
        analysisConfig.setMinRiskScore(minRiskScore);
        analysisConfig.setAnalysisTypes(new ArrayList<>(analysisTypes));
        if (excluded != null) {
            synchronized (analysisConfig) {
                analysisConfig.setExcludedSignatures(new ArrayList<>(excluded));
            }
        }

        return getAnalysisConfig();
    }

    // ── Scoring (read-only) ──

    @Operation(summary = "Get risk scoring weights and their version")
    @GetMapping("/scoring")
    public ResponseEntity<Map<String, Object>> getScoringWeights() {
        AnalysisConfig.ScoringWeights weights = analysisConfig.getScoring();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("version", weights.getVersion());
        config.put("perExtraController", weights.getPerExtraController());
        config.put("perExtraControllerType", weights.getPerExtraControllerType());
        config.put("teamPresent", weights.getTeamPresent());
        config.put("organizationPresent", weights.getOrganizationPresent());
        config.put("perFlaggedAction", weights.getPerFlaggedAction());
        config.put("perMultiRoleTeam", weights.getPerMultiRoleTeam());
        return ResponseEntity.ok(config);
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
