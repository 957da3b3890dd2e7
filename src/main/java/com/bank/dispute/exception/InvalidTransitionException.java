package com.bank.dispute.exception;

import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;

import java.util.Map;
import java.util.Set;

public class InvalidTransitionException extends DisputeWorkflowException {

    private final DisputeStatus currentStatus;
    private final EventType attempted;
    private final Set<EventType> validEvents;

    public InvalidTransitionException(String disputeId, DisputeStatus currentStatus,
                                      EventType attempted, Set<EventType> validEvents) {
        super(ErrorCode.INVALID_TRANSITION, disputeId,
                String.format("Event %s is not valid for dispute %s in status %s", attempted, disputeId, currentStatus));
        this.currentStatus = currentStatus;
        this.attempted = attempted;
        this.validEvents = Set.copyOf(validEvents);
    }

    public DisputeStatus getCurrentStatus() {
        return currentStatus;
    }

    public EventType getAttempted() {
        return attempted;
    }

    public Set<EventType> getValidEvents() {
        return validEvents;
    }

    @Override
    public Object getDetails() {
        return Map.of("currentStatus", currentStatus, "validEvents", validEvents);
    }
}
