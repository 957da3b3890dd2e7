package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Signals newly raised by one SLA tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickReport {
    private Instant tickedAt;
    private int slaBreaches;
    private int backlogSignals;
    private int deadlinesMissed;
}
