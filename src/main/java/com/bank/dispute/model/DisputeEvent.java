package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A request to move a dispute through its lifecycle. Which optional fields are
 * read depends on {@link #type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Lifecycle event posted against a dispute")
public class DisputeEvent {

    @Schema(description = "Event type", example = "SUBMIT_EVIDENCE")
    private EventType type;

    @Schema(description = "Caller identity recorded in the audit trail", example = "specialist:jdoe")
    private String actor;

    @Schema(description = "Caller-supplied token; replays with the same token return the original result")
    private String idempotencyKey;

    @Schema(description = "SUBMIT_EVIDENCE: evidence type tag", example = "RECEIPT")
    private String evidenceType;

    @Schema(description = "SUBMIT_EVIDENCE: evidence text")
    private String evidenceContent;

    @Schema(description = "RECLASSIFY_INSTRUMENT: the class determined by the specialist", example = "DEBIT")
    private PaymentInstrumentClass instrumentClass;

    @Schema(description = "NETWORK_OUTCOME: result reported by the card network collaborator", example = "ACCEPTED")
    private NetworkOutcome networkOutcome;

    @Schema(description = "Automated-decision confidence in [0,1] from an external scoring step", example = "0.82")
    private Double confidence;

    @Schema(description = "Optional free text note recorded in the audit detail")
    private String note;
}
