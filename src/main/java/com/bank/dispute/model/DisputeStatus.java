package com.bank.dispute.model;

import java.util.EnumSet;
import java.util.Set;

public enum DisputeStatus {
    FILED,
    AWAITING_EVIDENCE,
    UNDER_REVIEW,
    ESCALATED_SPECIALIST,
    ESCALATED_MANAGER,
    APPROVED,
    DENIED,
    RESOLVED,
    CLOSED_REFUNDED;

    private static final Set<DisputeStatus> TERMINAL = EnumSet.of(RESOLVED, CLOSED_REFUNDED);

    // Entering one of these starts (or continues) an investigation clock
    private static final Set<DisputeStatus> CLOCKED = EnumSet.of(AWAITING_EVIDENCE, UNDER_REVIEW);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean startsInvestigationClock() {
        return CLOCKED.contains(this);
    }

    public boolean isConcluded() {
        return this == APPROVED || this == DENIED || isTerminal();
    }
}
