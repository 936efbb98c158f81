package com.stpa.coverage.model;

public enum ControllerType {
    HUMAN,
    SOFTWARE,
    TEAM,
    ORGANIZATION,
    HYBRID
}
