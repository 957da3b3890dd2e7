package com.bank.dispute.exception;

public class DisputeNotFoundException extends DisputeWorkflowException {

    public DisputeNotFoundException(String disputeId) {
        super(ErrorCode.DISPUTE_NOT_FOUND, disputeId, "Dispute not found: " + disputeId);
    }
}
