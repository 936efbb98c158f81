package com.stpa.coverage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"signature", "controllerIds", "actionIds", "abstraction", "type",
        "riskScore", "riskBand", "rationale", "description", "members", "scoringVersion"})
@Schema(description = "A candidate unsafe combination of control actions across controllers")
public class CandidateCombination {

    @Schema(description = "Content-derived key: sorted controller ids | sorted action ids | type | abstraction",
            example = "CTRL-AP,CTRL-PF|CA-AP-1,CA-PF-2|CO_OCCURRENCE|CROSS_CONTROLLER")
    private String signature;

    @Schema(description = "Sorted distinct controller ids", example = "[\"CTRL-AP\", \"CTRL-PF\"]")
    private List<String> controllerIds;

    @Schema(description = "Sorted action ids", example = "[\"CA-AP-1\", \"CA-PF-2\"]")
    private List<String> actionIds;

    @Schema(description = "Abstraction level", example = "CROSS_CONTROLLER")
    private AbstractionLevel abstraction;

    @Schema(description = "Combination type", example = "CO_OCCURRENCE")
    private CombinationType type;

    @Schema(description = "Deterministic risk score (0-100)", example = "38")
    private int riskScore;

    @Schema(description = "Risk band derived from the score", example = "LOW")
    private RiskBand riskBand;

    @Schema(description = "Which scoring rules fired",
            example = "multiple controllers (2) involved; controller type diversity (2 types); team coordination required")
    private String rationale;

    @Schema(description = "Readable sentence naming the controllers and actions",
            example = "Autopilot provides engage altitude hold together with Pilot Flying provides adjust pitch")
    private String description;

    @Schema(description = "(controller, action) members in canonical order")
    private List<ActionRef> members;

    @Schema(description = "Version of the scoring weights that produced the score", example = "v1")
    private String scoringVersion;

    @JsonIgnore
    public int size() {
        return members == null ? 0 : members.size();
    }

    @JsonIgnore
    public Set<String> distinctControllers() {
        return members.stream().map(ActionRef::controllerId).collect(Collectors.toCollection(TreeSet::new));
    }

    public static String signatureOf(List<String> controllerIds, List<String> actionIds,
                                     CombinationType type, AbstractionLevel abstraction) {
        return String.join(",", controllerIds) + "|" + String.join(",", actionIds) + "|" + type + "|" + abstraction;
    }
}
