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
@Schema(description = "A unit of queue work owned by the routing engine")
public class RoutedItem {

    @Schema(description = "Routed item identifier", example = "DSP-7f3a2c91:2")
    private String itemId;

    private String disputeId;

    private QueueType queue;

    private RoutedItemStatus status;

    private String reason;

    private long amountMinor;

    private Instant assignedAt;

    private Instant acknowledgedAt;

    private Instant actionedAt;

    @Schema(description = "Acknowledgment SLA due instant; null for the auto queue")
    private Instant slaDueAt;

    @Schema(description = "Number of times the item was re-opened after being actioned")
    private int reopenCount;
}
