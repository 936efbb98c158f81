package com.stpa.coverage.model;

public enum RiskBand {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskBand fromScore(int score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}
