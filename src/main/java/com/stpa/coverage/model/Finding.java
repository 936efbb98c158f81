package com.stpa.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An unsafe-action record already held by the external store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Finding {
    private String id;
    private String controllerId;
    private String controlActionId;
    private String analysisTypeId;      // e.g. "NOT_PROVIDED"
    private String context;
}
