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
public class EscalateToManagerHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(DisputeStatus.UNDER_REVIEW);

    @Override
    public EventType getSupportedEventType() {
        return EventType.ESCALATE_TO_MANAGER;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.ESCALATED_MANAGER)
                .routing(RoutingDirective.assign(QueueType.MANAGER, "manual escalation"))
                .build();
    }
}
