package com.bank.dispute.exception;

import java.util.Map;

public class EvidenceLimitExceededException extends DisputeWorkflowException {

    private final String limit;
    private final long allowed;
    private final long attempted;

    public EvidenceLimitExceededException(String disputeId, String limit, long allowed, long attempted) {
        super(ErrorCode.EVIDENCE_LIMIT_EXCEEDED, disputeId,
                String.format("Evidence %s limit exceeded for dispute %s: allowed=%d, attempted=%d",
                        limit, disputeId, allowed, attempted));
        this.limit = limit;
        this.allowed = allowed;
        this.attempted = attempted;
    }

    @Override
    public Object getDetails() {
        return Map.of("limit", limit, "allowed", allowed, "attempted", attempted);
    }
}
