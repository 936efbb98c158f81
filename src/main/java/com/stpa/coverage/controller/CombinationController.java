package com.stpa.coverage.controller;

import com.stpa.coverage.config.AnalysisConfig;
import com.stpa.coverage.event.CombinationDecisionEvent;
import com.stpa.coverage.exception.GraphCycleException;
import com.stpa.coverage.exception.InvalidConfigurationException;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.HierarchyView;
import com.stpa.coverage.model.RankRequest;
import com.stpa.coverage.model.RankingResult;
import com.stpa.coverage.model.ReviewDecision;
import com.stpa.coverage.service.CombinationAnalysisService;
import com.stpa.coverage.service.CombinationExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/combinations")
@Tag(name = "Combinations", description = "Enumerate, score and rank multi-controller unsafe-action combinations")
public class CombinationController {

    private final CombinationAnalysisService analysisService;
    private final CombinationExportService exportService;
    private final AnalysisConfig analysisConfig;

    public CombinationController(CombinationAnalysisService analysisService,
                                 CombinationExportService exportService,
                                 AnalysisConfig analysisConfig) {
        this.analysisService = analysisService;
        this.exportService = exportService;
        this.analysisConfig = analysisConfig;
    }

    @PostMapping("/rank")
    @Operation(summary = "Rank candidate combinations",
               description = "Generates, scores and orders candidates for the snapshot. "
                       + "Optional fields override the configured enumeration options for this request only.")
    @ApiResponse(responseCode = "200", description = "Ranked candidates",
                 content = @Content(schema = @Schema(implementation = RankingResult.class)))
    @ApiResponse(responseCode = "409", description = "Control structure contains a cycle")
    public ResponseEntity<?> rank(@RequestBody RankRequest request) {
        if (request.getSnapshot() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "snapshot is required", "field", "snapshot"));
        }
        try {
            RankingResult result = analysisService.rank(request.getSnapshot(),
                    request.applyTo(analysisConfig.toGenerationOptions()));
            return ResponseEntity.ok(result);
        } catch (GraphCycleException e) {
            return cycle(e);
        } catch (InvalidConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
        }
    }

    @PostMapping("/export")
    @Operation(summary = "Export ranked combinations",
               description = "Same ranking as /rank, rendered as a JSON array or CSV (format=json|csv)")
    public ResponseEntity<?> export(@RequestBody RankRequest request,
                                    @RequestParam(defaultValue = "json") String format) {
        if (request.getSnapshot() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "snapshot is required", "field", "snapshot"));
        }
        try {
            CombinationExportService.Format exportFormat = CombinationExportService.Format.parse(format);
            RankingResult result = analysisService.rank(request.getSnapshot(),
                    request.applyTo(analysisConfig.toGenerationOptions()));
            String body = exportService.export(result.getCandidates(), exportFormat);
            MediaType contentType = exportFormat == CombinationExportService.Format.CSV
                    ? new MediaType("text", "csv")
                    : MediaType.APPLICATION_JSON;
            return ResponseEntity.ok()
                    .contentType(contentType)
                    .body(body);
        } catch (GraphCycleException e) {
            return cycle(e);
        } catch (InvalidConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "format"));
        }
    }

    @PostMapping("/decisions")
    @Operation(summary = "Record a reviewer decision",
               description = "Mark a candidate signature as ACCEPTED or REJECTED. Rejected signatures are excluded from later rankings.")
    public ResponseEntity<?> recordDecision(@RequestBody Map<String, String> body) {
        String signature = body.get("signature");
        String decision = body.get("decision");
        String decidedBy = body.getOrDefault("decidedBy", "analyst");

        if (signature == null || signature.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "signature is required", "field", "signature"));
        }
        if (decision == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "decision is required", "field", "decision"));
        }

        try {
            ReviewDecision reviewDecision = ReviewDecision.valueOf(decision.toUpperCase());
            CombinationDecisionEvent event = analysisService.recordDecision(
                    signature, reviewDecision, decidedBy, body.get("comment"));
            return ResponseEntity.ok(event);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "decision"));
        }
    }

    @PostMapping("/hierarchy")
    @Operation(summary = "Compute the controller hierarchy",
               description = "Returns hierarchy levels and the bottom-up visiting order for the snapshot")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = HierarchyView.class)))
    public ResponseEntity<?> hierarchy(@RequestBody AnalysisSnapshot snapshot) {
        try {
            return ResponseEntity.ok(analysisService.hierarchy(snapshot));
        } catch (GraphCycleException e) {
            return cycle(e);
        }
    }

    private ResponseEntity<Map<String, Object>> cycle(GraphCycleException e) {
        return ResponseEntity.status(409).body(Map.of("error", e.getMessage(), "controllerIds", e.getControllerIds()));
    }
}
