package com.stpa.coverage.model;

public enum CombinationType {
    // simultaneous provide / not-provide conflicts
    CO_OCCURRENCE,
    // unsafe sequencing or timing
    TEMPORAL_ORDERING
}
