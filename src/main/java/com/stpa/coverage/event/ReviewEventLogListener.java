package com.stpa.coverage.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ReviewEventLogListener {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventLogListener.class);

    @EventListener
    public void onDecision(CombinationDecisionEvent event) {
        log.info("Combination {}: signature={}, by={}", event.decision(), event.signature(), event.decidedBy());
    }

    @EventListener
    public void onTransition(CoverageTransitionEvent event) {
        log.info("Coverage {}: session={}, cell={}/{}/{}#{}", event.transition(), event.sessionId(),
                event.cell().getControllerId(), event.cell().getControlActionId(),
                event.cell().getAnalysisTypeId(), event.cell().getInstanceIndex());
    }
}
