package com.bank.dispute.service;

import com.bank.dispute.model.Signal;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers one signal through the notifier with the {@code notifier} retry.
 * Runs on the signal delivery pool so the SLA tick never waits on a slow channel.
 */
@Service
public class SignalDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(SignalDeliveryService.class);

    static final String INSTANCE = "notifier";

    private final SignalNotifier notifier;
    private final Retry retry;

    public SignalDeliveryService(SignalNotifier notifier, RetryRegistry retryRegistry) {
        this.notifier = notifier;
        this.retry = retryRegistry.retry(INSTANCE);

        retry.getEventPublisher().onRetry(event ->
                log.warn("Signal delivery attempt {} failed: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * @return a future completing with true once delivered, false when every attempt failed
     */
    @Async("signalDeliveryExecutor")
    public CompletableFuture<Boolean> deliver(Signal signal) {
        try {
            Retry.decorateRunnable(retry, () -> notifier.deliver(signal)).run();
            return CompletableFuture.completedFuture(true);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(deliverFallback(signal, e));
        }
    }

    private boolean deliverFallback(Signal signal, RuntimeException e) {
        log.error("Signal {} for dispute {} could not be delivered: {}", signal.getKind(), signal.getDisputeId(), e.getMessage());
        return false;
    }
}
