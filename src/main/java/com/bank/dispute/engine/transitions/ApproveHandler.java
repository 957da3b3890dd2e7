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

@Component
public class ApproveHandler implements TransitionHandler {

    static final Set<DisputeStatus> DECISION_SOURCES =
            EnumSet.of(DisputeStatus.UNDER_REVIEW, DisputeStatus.ESCALATED_MANAGER);

    @Override
    public EventType getSupportedEventType() {
        return EventType.APPROVE;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return DECISION_SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        working.setConcludedAt(asOf);
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.APPROVED)
                .routing(RoutingDirective.release("decision recorded"))
                .detail("dispute approved")
                .build();
    }
}
