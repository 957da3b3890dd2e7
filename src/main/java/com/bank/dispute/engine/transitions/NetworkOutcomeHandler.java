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

/**
 * Result reported by the card network for a submitted evidence package.
 * Acceptance approves, rejection denies, and a timeout puts the case in
 * front of a manager.
 */
@Component
public class NetworkOutcomeHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(DisputeStatus.UNDER_REVIEW);

    @Override
    public EventType getSupportedEventType() {
        return EventType.NETWORK_OUTCOME;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        if (event.getNetworkOutcome() == null) {
            throw new IllegalArgumentException("NETWORK_OUTCOME requires networkOutcome");
        }
        String detail = "network outcome " + event.getNetworkOutcome();
        return switch (event.getNetworkOutcome()) {
            case ACCEPTED -> {
                working.setConcludedAt(asOf);
                yield TransitionEffect.builder()
                        .targetStatus(DisputeStatus.APPROVED)
                        .routing(RoutingDirective.release("network accepted"))
                        .detail(detail)
                        .build();
            }
            case REJECTED -> {
                working.setConcludedAt(asOf);
                yield TransitionEffect.builder()
                        .targetStatus(DisputeStatus.DENIED)
                        .routing(RoutingDirective.release("network rejected"))
                        .detail(detail)
                        .build();
            }
            case TIMEOUT -> TransitionEffect.builder()
                    .targetStatus(DisputeStatus.ESCALATED_MANAGER)
                    .routing(RoutingDirective.assign(QueueType.MANAGER, "network submission timed out"))
                    .detail(detail)
                    .build();
        };
    }
}
