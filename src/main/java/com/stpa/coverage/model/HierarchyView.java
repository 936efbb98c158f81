package com.stpa.coverage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Controller hierarchy levels and the guided visiting order")
public class HierarchyView {

    @Schema(description = "Controllers per level, level 0 first, each level in lateral order")
    private List<List<String>> levels;

    @Schema(description = "Level of each controller")
    private Map<String, Integer> levelByController;

    @Schema(description = "Bottom-up, left-to-right visiting order")
    private List<String> visitingOrder;
}
