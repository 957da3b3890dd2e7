package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What a transition asks of the routing layer once the dispute itself has moved.
 */
@Data
@AllArgsConstructor
public class RoutingDirective {

    public enum Kind {
        NONE,           // ownership unchanged
        EVALUATE,       // run the routing rules
        ASSIGN,         // explicit hand-off to a queue
        REOPEN,         // re-queue a previously actioned item on the given queue
        RELEASE,        // case leaves all queues
        ACKNOWLEDGE     // queue consumer picked the case up
    }

    private Kind kind;
    private QueueType queue;
    private String reason;

    public static RoutingDirective none() {
        return new RoutingDirective(Kind.NONE, null, null);
    }

    public static RoutingDirective evaluate() {
        return new RoutingDirective(Kind.EVALUATE, null, null);
    }

    public static RoutingDirective assign(QueueType queue, String reason) {
        return new RoutingDirective(Kind.ASSIGN, queue, reason);
    }

    public static RoutingDirective reopen(QueueType queue, String reason) {
        return new RoutingDirective(Kind.REOPEN, queue, reason);
    }

    public static RoutingDirective release(String reason) {
        return new RoutingDirective(Kind.RELEASE, QueueType.NONE, reason);
    }

    public static RoutingDirective acknowledge() {
        return new RoutingDirective(Kind.ACKNOWLEDGE, null, null);
    }
}
