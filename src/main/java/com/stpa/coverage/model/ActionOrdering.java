package com.stpa.coverage.model;

import java.util.Comparator;

public final class ActionOrdering {

    public static final Comparator<ControlAction> BY_CONTROLLER_THEN_ID =
            Comparator.comparing(ControlAction::getControllerId)
                    .thenComparing(ControlAction::getId);

    private ActionOrdering() {}
}
