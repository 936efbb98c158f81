package com.stpa.coverage.model;

/**
 * Identity of a coverage cell. Instance 0 always exists for an in-scope cell;
 * higher instances hold additional findings for the same (controller, action, type).
 */
public record CellKey(String controllerId, String controlActionId, String analysisTypeId, int instanceIndex) {

    public CellKey withInstance(int instance) {
        return new CellKey(controllerId, controlActionId, analysisTypeId, instance);
    }

    public boolean sameCell(CellKey other) {
        return other != null
                && controllerId.equals(other.controllerId)
                && controlActionId.equals(other.controlActionId)
                && analysisTypeId.equals(other.analysisTypeId);
    }
}
