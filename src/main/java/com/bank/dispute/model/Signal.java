package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {
    private String disputeId;       // null for queue-level signals
    private SignalKind kind;
    private String detail;
    private Instant occurredAt;
}
