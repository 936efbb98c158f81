package com.stpa.coverage.engine.coverage;

import com.stpa.coverage.model.CoverageCell;

/**
 * Receives cell transitions so they can be reported to the external store.
 */
@FunctionalInterface
public interface CoverageListener {

    CoverageListener NONE = (cell, transition) -> { };

    void onTransition(CoverageCell cell, CoverageTransition transition);
}
