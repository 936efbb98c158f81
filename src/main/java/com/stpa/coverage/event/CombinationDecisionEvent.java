package com.stpa.coverage.event;

import com.stpa.coverage.model.ReviewDecision;

/**
 * A reviewer accepted or rejected a ranked candidate. Published for the external store.
 */
public record CombinationDecisionEvent(String signature, ReviewDecision decision, String decidedBy,
                                       String comment, long decidedAt) {
}
