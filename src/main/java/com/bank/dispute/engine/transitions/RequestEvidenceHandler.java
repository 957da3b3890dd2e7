package com.bank.dispute.engine.transitions;

import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Opens the evidence-gathering phase. From a specialist escalation this hands
 * the case back once it has been classified.
 *
 * Entering AWAITING_EVIDENCE starts the investigation clock, so deadlines are
 * stamped by the state machine. An unrecognized instrument coming from FILED
 * is diverted to a specialist instead.
 */
@Component
public class RequestEvidenceHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES =
            EnumSet.of(DisputeStatus.FILED, DisputeStatus.ESCALATED_SPECIALIST);

    @Override
    public EventType getSupportedEventType() {
        return EventType.REQUEST_EVIDENCE;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.AWAITING_EVIDENCE)
                .detail("evidence requested from cardholder")
                .build();
    }
}
