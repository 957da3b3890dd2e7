package com.bank.dispute.exception;

public class DownstreamUnavailableException extends DisputeWorkflowException {

    private final String collaborator;

    public DownstreamUnavailableException(String collaborator, String message, Throwable cause) {
        super(ErrorCode.DOWNSTREAM_UNAVAILABLE, null, collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
