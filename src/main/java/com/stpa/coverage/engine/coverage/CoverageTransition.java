package com.stpa.coverage.engine.coverage;

public enum CoverageTransition {
    COMPLETED,
    SKIPPED,
    INSTANCE_ADDED
}
