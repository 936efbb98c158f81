package com.stpa.coverage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A control action a controller can issue")
public class ControlAction {

    @Schema(description = "Control action identifier", example = "CA-AP-1")
    private String id;

    @Schema(description = "Owning controller id", example = "CTRL-AP")
    private String controllerId;

    @Schema(description = "Action verb", example = "engage")
    private String verb;

    @Schema(description = "Action object", example = "altitude hold")
    private String object;

    private String description;

    @Schema(description = "Excluded from enumeration and traversal when true", example = "false")
    private boolean outOfScope;

    @JsonIgnore
    public boolean isInScope() {
        return !outOfScope;
    }

    @JsonIgnore
    public String label() {
        String v = verb == null ? "" : verb.trim();
        String o = object == null ? "" : object.trim();
        String label = (v + " " + o).trim();
        return label.isEmpty() ? id : label;
    }
}
