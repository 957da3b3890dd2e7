package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a successful transition; replayed verbatim for a repeated idempotency key")
public class TransitionResult {
    private String disputeId;
    private EventType eventType;
    private DisputeStatus fromStatus;
    private DisputeStatus toStatus;
    private QueueType queue;
    private Instant appliedAt;
    private Dispute dispute;
}
