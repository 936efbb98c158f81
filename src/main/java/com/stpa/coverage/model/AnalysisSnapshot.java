package com.stpa.coverage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of the external store's controllers, control actions, control paths
 * and existing findings. Every engine component is a pure function of one snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Snapshot of the control structure and existing findings")
public class AnalysisSnapshot {

    @Builder.Default
    private List<Controller> controllers = new ArrayList<>();

    @Builder.Default
    private List<ControlAction> controlActions = new ArrayList<>();

    @Builder.Default
    private List<ControlPath> controlPaths = new ArrayList<>();

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();

    @Builder.Default
    private List<RecordedCombination> recordedCombinations = new ArrayList<>();

    @JsonIgnore
    public Map<String, Controller> controllersById() {
        if (controllers == null) return Collections.emptyMap();
        return controllers.stream()
                .collect(Collectors.toMap(Controller::getId, Function.identity(), (a, b) -> a));
    }

    /**
     * In-scope actions whose owning controller exists, sorted by (controllerId, actionId).
     */
    @JsonIgnore
    public List<ControlAction> inScopeActions() {
        if (controlActions == null) return Collections.emptyList();
        Map<String, Controller> byId = controllersById();
        return controlActions.stream()
                .filter(ControlAction::isInScope)
                .filter(a -> byId.containsKey(a.getControllerId()))
                .sorted(ActionOrdering.BY_CONTROLLER_THEN_ID)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<Finding> safeFindings() {
        return findings == null ? Collections.emptyList() : findings;
    }

    @JsonIgnore
    public List<RecordedCombination> safeRecordedCombinations() {
        return recordedCombinations == null ? Collections.emptyList() : recordedCombinations;
    }

    @JsonIgnore
    public List<ControlPath> safeControlPaths() {
        return controlPaths == null ? Collections.emptyList() : controlPaths;
    }
}
