package com.bank.dispute.exception;

public class DeadlineComputationException extends DisputeWorkflowException {

    public DeadlineComputationException(String disputeId, String message) {
        super(ErrorCode.DEADLINE_COMPUTATION_FAILURE, disputeId, message);
    }
}
