package com.bank.dispute.engine.transitions;

import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.RoutingDirective;
import com.bank.dispute.model.RoutingInfo;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * A specialist or manager picked up the case. Stops the acknowledgment SLA clock.
 */
@Component
public class AcknowledgeHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(
            DisputeStatus.FILED, DisputeStatus.AWAITING_EVIDENCE, DisputeStatus.UNDER_REVIEW,
            DisputeStatus.ESCALATED_SPECIALIST, DisputeStatus.ESCALATED_MANAGER,
            DisputeStatus.APPROVED, DisputeStatus.DENIED);

    @Override
    public EventType getSupportedEventType() {
        return EventType.ACKNOWLEDGE;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public boolean canApply(Dispute dispute) {
        RoutingInfo routing = dispute.getRouting();
        return SOURCES.contains(dispute.getStatus())
                && routing != null
                && routing.getQueue() != null
                && routing.getQueue().isHumanQueue()
                && routing.getAcknowledgedAt() == null;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        working.getRouting().setAcknowledgedAt(asOf);
        return TransitionEffect.builder()
                .routing(RoutingDirective.acknowledge())
                .detail("acknowledged on " + working.getRouting().getQueue() + " queue")
                .build();
    }
}
