package com.bank.dispute.engine;

import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;

import java.time.Instant;
import java.util.Set;

/**
 * Handles one event type. Implementations are discovered by the state machine,
 * one per {@link EventType}.
 */
public interface TransitionHandler {

    EventType getSupportedEventType();

    /**
     * Statuses from which the event is accepted.
     */
    Set<DisputeStatus> getSourceStatuses();

    /**
     * Whether the event is currently valid. Handlers with extra preconditions
     * beyond the source status override this.
     */
    default boolean canApply(Dispute dispute) {
        return getSourceStatuses().contains(dispute.getStatus());
    }

    /**
     * Mutate the working copy and describe the outcome. Throwing discards the copy.
     *
     * @param working a private deep copy of the dispute
     * @param event   the event being applied
     * @param asOf    the transition instant
     */
    TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf);
}
