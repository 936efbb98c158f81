package com.stpa.coverage.exception;

import java.util.List;

/**
 * The control-structure graph contains a cycle, so no bottom-up order exists.
 * Halts the guided workflow for the affected session.
 */
public class GraphCycleException extends RuntimeException {

    private final List<String> controllerIds;

    public GraphCycleException(List<String> controllerIds) {
        super("Control structure contains a cycle; controllers that cannot be ordered: " + controllerIds);
        this.controllerIds = List.copyOf(controllerIds);
    }

    public List<String> getControllerIds() {
        return controllerIds;
    }
}
