package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Append-only audit record for a dispute")
public class AuditEntry {

    @Schema(description = "Dispute the entry belongs to", example = "DSP-7f3a2c")
    private String disputeId;

    @Schema(description = "Per-dispute monotonically increasing sequence number", example = "3")
    private long sequence;

    @Schema(description = "Who caused the entry", example = "specialist:jdoe")
    private String actor;

    @Schema(description = "What happened", example = "SUBMIT_EVIDENCE")
    private String action;

    private Instant timestamp;

    @Schema(description = "Guardrail-approved detail text")
    private String detail;
}
