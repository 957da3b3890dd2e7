package com.bank.dispute.engine.transitions;

import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.RoutingDirective;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closes evidence gathering. Emits the evidence package for the card network
 * and asks for a fresh routing decision.
 */
@Component
public class BeginReviewHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES =
            EnumSet.of(DisputeStatus.AWAITING_EVIDENCE, DisputeStatus.ESCALATED_SPECIALIST);

    @Override
    public EventType getSupportedEventType() {
        return EventType.BEGIN_REVIEW;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.UNDER_REVIEW)
                .routing(RoutingDirective.evaluate())
                .emitEvidencePackage(true)
                .detail(String.format("review started with %d evidence item(s)", working.getEvidence().size()))
                .build();
    }
}
