package com.stpa.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed control edge: source controller issues control to the target, which is either
 * another controller or a controlled component.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlPath {
    private String id;
    private String sourceControllerId;
    private String targetId;
    private String controls;
}
