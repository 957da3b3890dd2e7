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
 * Immediate refund of a freshly filed dispute, closing it without investigation.
 */
@Component
public class RefundHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(DisputeStatus.FILED);

    @Override
    public EventType getSupportedEventType() {
        return EventType.REFUND;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        working.setConcludedAt(asOf);
        return TransitionEffect.builder()
                .targetStatus(DisputeStatus.CLOSED_REFUNDED)
                .routing(RoutingDirective.release("refunded"))
                .detail(String.format("refunded %d %s", working.getAmountMinor(), working.getCurrency()))
                .build();
    }
}
