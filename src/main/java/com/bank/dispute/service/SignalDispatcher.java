package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raises each signal at most once per key and hands it to
 * {@link SignalDeliveryService}. A signal whose delivery failed on every
 * attempt is sent again the next time the same key is raised.
 * <p>
 * Keys are scoped per dispute ({@code disputeId + ":" + ...}) or per queue;
 * dispute-scoped keys are dropped once the dispute closes.
 */
@Component
public class SignalDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SignalDispatcher.class);

    public enum DeliveryState {
        PENDING,
        DELIVERED,
        FAILED
    }

    private final Map<String, DeliveryState> states = new ConcurrentHashMap<>();

    private final SignalDeliveryService delivery;
    private final MetricsConfig metricsConfig;

    public SignalDispatcher(SignalDeliveryService delivery, MetricsConfig metricsConfig) {
        this.delivery = delivery;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return true when the signal was newly raised (or re-attempted after a
     *         failed delivery); false when the key was already raised
     */
    public boolean raise(String key, Signal signal) {
        DeliveryState previous = states.putIfAbsent(key, DeliveryState.PENDING);
        if (previous == null) {
            metricsConfig.recordSignal(signal.getKind().name());
            log.info("Signal raised: {} ({})", key, signal.getKind());
            dispatch(key, signal);
            return true;
        }
        if (previous == DeliveryState.FAILED && states.replace(key, DeliveryState.FAILED, DeliveryState.PENDING)) {
            log.info("Re-attempting delivery of signal {}", key);
            dispatch(key, signal);
            return true;
        }
        return false;
    }

    /**
     * One-shot signal with no de-duplication key, e.g. a guardrail rejection.
     * Nothing is retained once delivery completes.
     */
    public void publish(Signal signal) {
        metricsConfig.recordSignal(signal.getKind().name());
        log.info("Signal published: {} for dispute {}", signal.getKind(), signal.getDisputeId());
        delivery.deliver(signal).whenComplete((delivered, error) -> {
            if (error != null) {
                log.error("Signal {} for dispute {} failed: {}", signal.getKind(), signal.getDisputeId(), error.getMessage());
            }
        });
    }

    /**
     * Forget a key so the condition can be raised again, e.g. once a backlog has drained.
     */
    public void clear(String key) {
        if (states.remove(key) != null) {
            log.info("Signal cleared: {}", key);
        }
    }

    /**
     * Drop every key scoped to a dispute. Called when the dispute closes.
     *
     * @return number of keys removed
     */
    public int forgetDispute(String disputeId) {
        String prefix = disputeId + ":";
        int before = states.size();
        states.keySet().removeIf(key -> key.startsWith(prefix));
        int removed = Math.max(0, before - states.size());
        if (removed > 0) {
            log.debug("Forgot {} signal key(s) of dispute {}", removed, disputeId);
        }
        return removed;
    }

    public DeliveryState state(String key) {
        return states.get(key);
    }

    public Map<String, DeliveryState> snapshot() {
        return Map.copyOf(states);
    }

    private void dispatch(String key, Signal signal) {
        delivery.deliver(signal).whenComplete((delivered, error) -> {
            boolean ok = error == null && Boolean.TRUE.equals(delivered);
            // a key forgotten while delivery was in flight stays forgotten
            states.computeIfPresent(key, (k, state) -> ok ? DeliveryState.DELIVERED : DeliveryState.FAILED);
            if (!ok) {
                log.error("Signal {} could not be delivered; will retry on next raise", key);
            }
        });
    }
}
