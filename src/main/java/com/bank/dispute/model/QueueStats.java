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
@Schema(description = "Point-in-time view of one routing queue")
public class QueueStats {
    private QueueType queue;
    private int depth;
    private int unacknowledged;
    @Schema(description = "Open items past their acknowledgment SLA")
    private int slaBreached;
    private int backlogThreshold;
    private Instant oldestAssignedAt;
}
