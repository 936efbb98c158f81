package com.stpa.coverage.model;

/**
 * SAME_TEAM: every participating controller belongs to one TEAM controller.
 * CROSS_CONTROLLER: anything else.
 */
public enum AbstractionLevel {
    SAME_TEAM,
    CROSS_CONTROLLER
}
