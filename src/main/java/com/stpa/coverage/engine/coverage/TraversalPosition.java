package com.stpa.coverage.engine.coverage;

/**
 * Non-terminal state of the guided traversal. The terminal state is represented by {@code null}.
 */
public record TraversalPosition(String controllerId, String controlActionId, int typeIndex, int instanceIndex) {

    TraversalPosition withInstance(int instance) {
        return new TraversalPosition(controllerId, controlActionId, typeIndex, instance);
    }
}
