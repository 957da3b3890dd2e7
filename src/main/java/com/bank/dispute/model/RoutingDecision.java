package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {
    private QueueType queue;
    private String reason;
    private boolean degraded;       // conservative fallback because a collaborator was unavailable

    public static RoutingDecision to(QueueType queue, String reason) {
        return new RoutingDecision(queue, reason, false);
    }

    public static RoutingDecision release(String reason) {
        return new RoutingDecision(QueueType.NONE, reason, false);
    }
}
