package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoutingInfo {
    private QueueType queue;
    private String reason;
    private Instant assignedAt;
    private Instant acknowledgedAt;     // null until a queue consumer picks the case up

    public static RoutingInfo none() {
        return RoutingInfo.builder().queue(QueueType.NONE).build();
    }
}
