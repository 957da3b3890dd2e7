package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Aggregate root of the workflow. Only {@code DisputeStateMachine} produces new
 * versions of a dispute; every other component reads snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A customer's formal challenge to a card transaction")
public class Dispute {

    @Schema(description = "Opaque dispute identifier", example = "DSP-7f3a2c91")
    private String id;

    @Schema(description = "Reference of the disputed charge in the core banking system", example = "CH-2026-000184")
    private String chargeReference;

    private DisputeStatus status;

    private DisputeReason reason;

    @Schema(description = "Disputed amount in minor units (cents)", example = "5000")
    private long amountMinor;

    @Schema(description = "ISO 4217 currency code", example = "USD")
    private String currency;

    private PaymentInstrumentClass instrumentClass;

    private Instant createdAt;

    @Schema(description = "Age of the cardholder account in days when the dispute was filed", example = "400")
    private Integer accountAgeDays;

    @Schema(description = "Whether the disputed transaction was cross-border")
    private boolean crossBorder;

    @Schema(description = "Whether the disputed transaction originated at a point of sale")
    private boolean pointOfSale;

    @Schema(description = "Statement cycle length for credit accounts", example = "30")
    private Integer billingCycleDays;

    @Schema(description = "Guardrail-approved customer narrative")
    private String narrative;

    @Builder.Default
    private List<EvidenceItem> evidence = new ArrayList<>();

    @Builder.Default
    private List<Deadline> deadlines = new ArrayList<>();

    @Builder.Default
    private RoutingInfo routing = RoutingInfo.none();

    @Builder.Default
    private List<AuditEntry> auditTrail = new ArrayList<>();

    private Instant investigationStartedAt;     // first move out of FILED
    private Instant provisionalCreditIssuedAt;
    private Instant concludedAt;                // approved, denied or refunded
    private Instant lastTransitionAt;

    private long version;

    /**
     * Deep copy: transitions work on the copy so a failed transition leaves the
     * original untouched.
     */
    public Dispute copy() {
        return toBuilder()
                .evidence(copyEach(evidence, e -> e.toBuilder().build()))
                .deadlines(copyEach(deadlines, d -> d.toBuilder().build()))
                .routing(routing != null ? routing.toBuilder().build() : RoutingInfo.none())
                .auditTrail(copyEach(auditTrail, a -> a.toBuilder().build()))
                .build();
    }

    public int totalEvidenceBytes() {
        return evidence == null ? 0 : evidence.stream().mapToInt(EvidenceItem::getSizeBytes).sum();
    }

    public long nextAuditSequence() {
        return auditTrail == null ? 1 : auditTrail.size() + 1L;
    }

    private static <T> List<T> copyEach(List<T> source, UnaryOperator<T> copier) {
        List<T> copy = new ArrayList<>();
        if (source != null) {
            for (T item : source) {
                copy.add(copier.apply(item));
            }
        }
        return copy;
    }
}
