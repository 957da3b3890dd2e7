package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Emitted to the network-submission collaborator when a dispute enters review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidencePackage {
    private String disputeId;
    private String chargeReference;
    private DisputeReason reason;
    private long amountMinor;
    private String currency;
    private List<EvidenceItem> evidence;
    private List<Deadline> deadlineSummary;
    private Instant emittedAt;
}
