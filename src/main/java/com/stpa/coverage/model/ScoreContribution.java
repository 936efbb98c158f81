package com.stpa.coverage.model;

/**
 * Points one scoring rule added to a candidate, with the phrase it contributes to the rationale.
 */
public record ScoreContribution(String ruleId, int points, String reason) {}
