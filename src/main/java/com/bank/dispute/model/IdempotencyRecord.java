package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {
    private String disputeId;
    private String idempotencyKey;
    private EventType eventType;
    private DisputeStatus sourceStatus;
    private TransitionResult result;
    private long storedAt;
}
