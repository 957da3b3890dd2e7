package com.bank.dispute.exception;

import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;

public class DisputeClosedException extends DisputeWorkflowException {

    private final DisputeStatus terminalStatus;

    public DisputeClosedException(String disputeId, DisputeStatus terminalStatus, EventType attempted) {
        super(ErrorCode.DISPUTE_CLOSED, disputeId,
                String.format("Dispute %s is %s; event %s ignored", disputeId, terminalStatus, attempted));
        this.terminalStatus = terminalStatus;
    }

    public DisputeStatus getTerminalStatus() {
        return terminalStatus;
    }
}
