package com.bank.dispute.engine.transitions;

import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutingDirective;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

@Component
public class EscalateToSpecialistHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES =
            EnumSet.of(DisputeStatus.FILED, DisputeStatus.AWAITING_EVIDENCE);

    @Override
    public EventType getSupportedEventType() {
        return EventType.ESCALATE_TO_SPECIALIST;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.ESCALATED_SPECIALIST)
                .routing(RoutingDirective.assign(QueueType.SPECIALIST, "manual escalation"))
                .build();
    }
}
