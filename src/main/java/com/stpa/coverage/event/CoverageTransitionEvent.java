package com.stpa.coverage.event;

import com.stpa.coverage.engine.coverage.CoverageTransition;
import com.stpa.coverage.model.CoverageCell;

public record CoverageTransitionEvent(String sessionId, CoverageCell cell, CoverageTransition transition,
                                      long occurredAt) {
}
