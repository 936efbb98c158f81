package com.stpa.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamRole {
    private String id;
    private String name;        // e.g. "Pilot Flying", "Pilot Monitoring"
}
