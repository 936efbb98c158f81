package com.stpa.coverage.model;

/**
 * Additive risk terms. Declaration order is the order rules are evaluated and their
 * reasons appear in a rationale.
 */
public enum ScoringRuleType {
    CONTROLLER_COUNT,
    TYPE_DIVERSITY,
    TEAM_PRESENCE,
    ORGANIZATION_PRESENCE,
    FLAGGED_ACTION,
    MULTI_ROLE_TEAM
}
