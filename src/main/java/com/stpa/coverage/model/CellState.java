package com.stpa.coverage.model;

public enum CellState {
    UNVISITED,
    COMPLETED,
    SKIPPED;

    public boolean isTerminal() {
        return this != UNVISITED;
    }
}
