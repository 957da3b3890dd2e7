package com.bank.dispute.exception;

import com.bank.dispute.model.EventType;

/**
 * An idempotency key was reused for a different event on the same dispute.
 * Reuse for the same event is not an error: the stored result is replayed.
 */
public class DuplicateRequestException extends DisputeWorkflowException {

    public DuplicateRequestException(String disputeId, String idempotencyKey,
                                     EventType original, EventType attempted) {
        super(ErrorCode.DUPLICATE_REQUEST, disputeId,
                String.format("Idempotency key %s already used for %s on dispute %s; cannot reuse for %s",
                        idempotencyKey, original, disputeId, attempted));
    }
}
