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
 * Records that provisional credit was posted. Only accepted once per dispute.
 */
@Component
public class IssueProvisionalCreditHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(
            DisputeStatus.AWAITING_EVIDENCE, DisputeStatus.UNDER_REVIEW,
            DisputeStatus.ESCALATED_SPECIALIST, DisputeStatus.ESCALATED_MANAGER);

    @Override
    public EventType getSupportedEventType() {
        return EventType.ISSUE_PROVISIONAL_CREDIT;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public boolean canApply(Dispute dispute) {
        return SOURCES.contains(dispute.getStatus()) && dispute.getProvisionalCreditIssuedAt() == null;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        working.setProvisionalCreditIssuedAt(asOf);
        return TransitionEffect.builder()
                .detail(String.format("provisional credit %d %s", working.getAmountMinor(), working.getCurrency()))
                .build();
    }
}
