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
@Schema(description = "A guardrail-approved piece of evidence attached to a dispute")
public class EvidenceItem {

    @Schema(description = "Evidence type tag", example = "RECEIPT")
    private String type;

    @Schema(description = "Evidence text payload")
    private String content;

    @Schema(description = "UTF-8 payload size in bytes", example = "312")
    private int sizeBytes;

    private Instant submittedAt;

    private String submittedBy;

    @Schema(description = "Whether the item was included in an evidence package sent to the card network")
    private boolean forwardedToNetwork;
}
