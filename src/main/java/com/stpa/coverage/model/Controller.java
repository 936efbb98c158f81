package com.stpa.coverage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A controller in the control structure (human, software, team, organization or hybrid)")
public class Controller {

    @Schema(description = "Controller identifier", example = "CTRL-AP")
    private String id;

    @Schema(description = "Display name", example = "Autopilot")
    private String name;

    @Schema(description = "Controller type", example = "SOFTWARE")
    private ControllerType type;

    @Schema(description = "Named roles declared by a TEAM controller")
    @Builder.Default
    private List<TeamRole> roles = new ArrayList<>();

    @Schema(description = "Id of the TEAM controller this controller is a member of", example = "CTRL-CREW")
    private String teamId;

    @JsonIgnore
    public boolean isTeam() {
        return type == ControllerType.TEAM;
    }

    @JsonIgnore
    public int roleCount() {
        return roles == null ? 0 : roles.size();
    }
}
