package com.stpa.coverage.model;

/**
 * One (controller, control action) member of a candidate combination.
 */
public record ActionRef(String controllerId, String actionId) {}
