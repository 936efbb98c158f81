package com.stpa.coverage.event;

import com.stpa.coverage.config.MetricsConfig;
import com.stpa.coverage.engine.coverage.CoverageListener;
import com.stpa.coverage.engine.coverage.CoverageTransition;
import com.stpa.coverage.model.CoverageCell;
import com.stpa.coverage.model.ReviewDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Turns review decisions and coverage transitions into Spring application events.
 */
@Component
public class ReviewEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventPublisher.class);

    private final ApplicationEventPublisher publisher;
    private final MetricsConfig metricsConfig;

    public ReviewEventPublisher(ApplicationEventPublisher publisher, MetricsConfig metricsConfig) {
        this.publisher = publisher;
        this.metricsConfig = metricsConfig;
    }

    public CombinationDecisionEvent publishDecision(String signature, ReviewDecision decision,
                                                    String decidedBy, String comment) {
        CombinationDecisionEvent event = new CombinationDecisionEvent(
                signature, decision, decidedBy, comment, System.currentTimeMillis());
        metricsConfig.recordDecision(decision.name());
        publisher.publishEvent(event);
        log.debug("Published decision event: signature={}, decision={}", signature, decision);
        return event;
    }

    public void publishTransition(String sessionId, CoverageCell cell, CoverageTransition transition) {
        metricsConfig.recordCoverageTransition(transition.name());
        publisher.publishEvent(new CoverageTransitionEvent(sessionId, cell, transition, System.currentTimeMillis()));
    }

    /** Listener bound to one session, handed to that session's tracker. */
    public CoverageListener listenerFor(String sessionId) {
        return (cell, transition) -> publishTransition(sessionId, cell, transition);
    }
}
