package com.stpa.coverage.model;

/**
 * How the guided workflow reached a controller. Informational only.
 * DOWNWARD only occurs when stepping back to a lower level.
 */
public enum Movement {
    INITIAL,
    LATERAL,
    UPWARD,
    DOWNWARD
}
