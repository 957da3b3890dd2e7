package com.bank.dispute.config;

import com.bank.dispute.model.QueueType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final Map<QueueType, AtomicInteger> queueDepths = new EnumMap<>(QueueType.class);

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        for (QueueType queue : QueueType.values()) {
            if (queue.isActive()) {
                queueDepths.put(queue, registry.gauge("routing.queue.depth",
                        List.of(Tag.of("queue", queue.name())), new AtomicInteger(0)));
            }
        }
    }

    public void recordTransition(String event, String outcome) {
        Counter.builder("dispute.transition.count")
                .tag("event", event)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordGuardrailRejection(String kind) {
        Counter.builder("guardrail.rejection.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRoutingDecision(String queue, boolean degraded) {
        Counter.builder("routing.decision.count")
                .tag("queue", queue)
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    public void recordSignal(String kind) {
        Counter.builder("signal.raised.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateQueueDepth(QueueType queue, int depth) {
        AtomicInteger gauge = queueDepths.get(queue);
        if (gauge != null) {
            gauge.set(depth);
        }
    }
}
