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
import java.util.Set;

@Component
public class DenyHandler implements TransitionHandler {

    @Override
    public EventType getSupportedEventType() {
        return EventType.DENY;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return ApproveHandler.DECISION_SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        working.setConcludedAt(asOf);
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.DENIED)
                .routing(RoutingDirective.release("decision recorded"))
                .detail("dispute denied")
                .build();
    }
}
