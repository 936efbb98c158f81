package com.stpa.coverage.controller;

import com.stpa.coverage.exception.GraphCycleException;
import com.stpa.coverage.model.AnalysisSnapshot;
import com.stpa.coverage.model.CellKey;
import com.stpa.coverage.model.CoverageCell;
import com.stpa.coverage.model.CoverageSummary;
import com.stpa.coverage.model.ReviewSession;
import com.stpa.coverage.model.SessionRequest;
import com.stpa.coverage.service.ReviewSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Review Sessions", description = "Guided bottom-up traversal of (controller, action, analysis type) cells")
public class ReviewSessionController {

    private final ReviewSessionService sessionService;

    public ReviewSessionController(ReviewSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @Operation(summary = "Open a review session",
               description = "Builds the controller hierarchy and positions the session on the first cell. 409 on a cyclic control structure.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ReviewSession.class)))
    public ResponseEntity<?> createSession(@RequestBody SessionRequest request) {
        try {
            return ResponseEntity.ok(sessionService.createSession(request));
        } catch (GraphCycleException e) {
            return cycle(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "snapshot"));
        }
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get session state")
    public ResponseEntity<ReviewSession> getSession(@PathVariable String sessionId) {
        ReviewSession session = sessionService.getSession(sessionId);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(session);
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Close a session")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        if (!sessionService.deleteSession(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/current")
    @Operation(summary = "Get the current cell",
               description = "204 once the traversal has moved past the last cell")
    public ResponseEntity<CoverageCell> currentCell(@PathVariable String sessionId) {
        ReviewSession session = sessionService.getSession(sessionId);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        if (session.getCurrentCell() == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(session.getCurrentCell());
    }

    @PostMapping("/{sessionId}/advance")
    @Operation(summary = "Advance to the next cell")
    public ResponseEntity<ReviewSession> advance(@PathVariable String sessionId) {
        ReviewSession session = sessionService.advance(sessionId);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(session);
    }

    @PostMapping("/{sessionId}/retreat")
    @Operation(summary = "Go back to the previous cell")
    public ResponseEntity<ReviewSession> retreat(@PathVariable String sessionId) {
        ReviewSession session = sessionService.retreat(sessionId);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(session);
    }

    @PostMapping("/{sessionId}/instances")
    @Operation(summary = "Add an instance to a cell",
               description = "Creates the next instance of the given cell (or the current cell when the body is empty) and moves onto it")
    public ResponseEntity<?> addInstance(@PathVariable String sessionId,
                                         @RequestBody(required = false) Map<String, Object> body) {
        if (!sessionService.hasSession(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        CellKey key;
        try {
            key = body == null || body.isEmpty() ? null : toCellKey(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "cell"));
        }
        CoverageCell cell = sessionService.addInstance(sessionId, key);
        if (cell == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "cell is not in scope for this session", "field", "cell"));
        }
        return ResponseEntity.ok(cell);
    }

    @PostMapping("/{sessionId}/cells/complete")
    @Operation(summary = "Mark a cell COMPLETED")
    public ResponseEntity<?> complete(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        return mark(sessionId, body, true);
    }

    @PostMapping("/{sessionId}/cells/skip")
    @Operation(summary = "Mark a cell SKIPPED")
    public ResponseEntity<?> skip(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        return mark(sessionId, body, false);
    }

    @GetMapping("/{sessionId}/cells")
    @Operation(summary = "List every cell of the session in traversal order")
    public ResponseEntity<List<CoverageCell>> cells(@PathVariable String sessionId) {
        List<CoverageCell> cells = sessionService.cells(sessionId);
        if (cells == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(cells);
    }

    @PutMapping("/{sessionId}/snapshot")
    @Operation(summary = "Re-scope the session",
               description = "Applies an updated snapshot. Recorded states are kept; the session restarts at the first cell if its current cell left scope.")
    public ResponseEntity<?> updateSnapshot(@PathVariable String sessionId, @RequestBody AnalysisSnapshot snapshot) {
        try {
            ReviewSession session = sessionService.updateSnapshot(sessionId, snapshot);
            if (session == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(session);
        } catch (GraphCycleException e) {
            return cycle(e);
        }
    }

    @GetMapping("/{sessionId}/summary")
    @Operation(summary = "Get coverage summary",
               description = "Totals, completion ratio and per-controller progress in visiting order")
    public ResponseEntity<CoverageSummary> summary(@PathVariable String sessionId) {
        CoverageSummary summary = sessionService.summary(sessionId);
        if (summary == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(summary);
    }

    // ── Helpers ──

    private ResponseEntity<?> mark(String sessionId, Map<String, Object> body, boolean completed) {
        CellKey key;
        try {
            key = toCellKey(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "cell"));
        }

        Boolean updated = completed
                ? sessionService.markCompleted(sessionId, key)
                : sessionService.markSkipped(sessionId, key);
        if (updated == null) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("updated", updated);
        response.put("completionRatio", sessionService.summary(sessionId).getCompletionRatio());
        return ResponseEntity.ok(response);
    }

    private CellKey toCellKey(Map<String, Object> body) {
        String controllerId = required(body, "controllerId");
        String controlActionId = required(body, "controlActionId");
        String analysisTypeId = required(body, "analysisTypeId");
        Object instance = body.get("instanceIndex");
        int instanceIndex;
        if (instance == null) {
            instanceIndex = 0;
        } else if (instance instanceof Number n) {
            instanceIndex = n.intValue();
        } else {
            try {
                instanceIndex = Integer.parseInt(instance.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("instanceIndex must be an integer");
            }
        }
        return new CellKey(controllerId, controlActionId, analysisTypeId, instanceIndex);
    }

    private String required(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null || v.toString().isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return v.toString();
    }

    private ResponseEntity<Map<String, Object>> cycle(GraphCycleException e) {
        return ResponseEntity.status(409).body(Map.of("error", e.getMessage(), "controllerIds", e.getControllerIds()));
    }
}
