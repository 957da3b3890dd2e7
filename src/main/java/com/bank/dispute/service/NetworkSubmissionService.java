package com.bank.dispute.service;

import com.bank.dispute.model.EvidencePackage;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget submission of evidence packages through the {@code network}
 * retry and circuit breaker. The returned future completes with the final status
 * once retries are exhausted; callers decide what a failure means for the dispute.
 */
@Service
public class NetworkSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(NetworkSubmissionService.class);

    static final String INSTANCE = "network";

    public enum SubmissionStatus {
        SUBMITTED,
        FAILED,
        SKIPPED
    }

    private final NetworkSubmissionClient client;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public NetworkSubmissionService(NetworkSubmissionClient client,
                                    RetryRegistry retryRegistry,
                                    CircuitBreakerRegistry circuitBreakerRegistry) {
        this.client = client;
        this.retry = retryRegistry.retry(INSTANCE);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE);

        retry.getEventPublisher().onRetry(event ->
                log.warn("Network submission attempt {} failed: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Async("collaboratorExecutor")
    public CompletableFuture<SubmissionStatus> submit(EvidencePackage evidencePackage) {
        if (!client.isAvailable()) {
            log.info("Network submission not configured; evidence package for dispute {} not sent",
                    evidencePackage.getDisputeId());
            return CompletableFuture.completedFuture(SubmissionStatus.SKIPPED);
        }

        Runnable send = Retry.decorateRunnable(retry,
                CircuitBreaker.decorateRunnable(circuitBreaker, () -> client.submit(evidencePackage)));
        try {
            send.run();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(submitFallback(evidencePackage, e));
        }
        log.info("Evidence package for dispute {} submitted ({} item(s))",
                evidencePackage.getDisputeId(), evidencePackage.getEvidence().size());
        return CompletableFuture.completedFuture(SubmissionStatus.SUBMITTED);
    }

    private SubmissionStatus submitFallback(EvidencePackage evidencePackage, RuntimeException e) {
        log.error("Network submission for dispute {} failed: {}", evidencePackage.getDisputeId(), e.getMessage());
        return SubmissionStatus.FAILED;
    }
}
