package com.bank.dispute.exception;

/**
 * Root of the workflow error taxonomy. Messages never carry payload text that
 * failed the compliance guardrail.
 */
public class DisputeWorkflowException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String disputeId;

    public DisputeWorkflowException(ErrorCode errorCode, String disputeId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.disputeId = disputeId;
    }

    public DisputeWorkflowException(ErrorCode errorCode, String disputeId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.disputeId = disputeId;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDisputeId() {
        return disputeId;
    }

    /** Extra fields for the error response body. */
    public Object getDetails() {
        return null;
    }
}
