package com.stpa.coverage.model;

public enum ReviewDecision {
    ACCEPTED,
    REJECTED
}
