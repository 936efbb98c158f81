package com.stpa.coverage.model;

public enum RankingStatus {
    OK,
    INSUFFICIENT_CONTROLLERS
}
