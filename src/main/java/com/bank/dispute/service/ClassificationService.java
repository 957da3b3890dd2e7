package com.bank.dispute.service;

import com.bank.dispute.config.CollaboratorConfig;
import com.bank.dispute.model.ClassificationResult;
import com.bank.dispute.model.Dispute;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Calls the classification collaborator through the {@code classification}
 * retry, circuit breaker and time limiter. Never throws: when the collaborator
 * cannot answer, the fallback returns a degraded result and routing falls back
 * to a manager.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    static final String INSTANCE = "classification";

    private final ClassificationClient client;
    private final CollaboratorConfig config;
    private final Executor executor;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;

    public ClassificationService(ClassificationClient client,
                                 CollaboratorConfig config,
                                 @Qualifier("collaboratorExecutor") Executor executor,
                                 RetryRegistry retryRegistry,
                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                 TimeLimiterRegistry timeLimiterRegistry) {
        this.client = client;
        this.config = config;
        this.executor = executor;
        this.retry = retryRegistry.retry(INSTANCE);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE);
        this.timeLimiter = timeLimiterRegistry.timeLimiter(INSTANCE);

        retry.getEventPublisher().onRetry(event ->
                log.warn("Classification attempt {} failed: {}",
                        event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())));
    }

    /**
     * @param suppliedConfidence confidence already produced by an upstream scoring
     *                           step; when present the collaborator is not called
     */
    @Observed(name = "classification.classify", contextualName = "classify-dispute")
    public ClassificationResult classify(Dispute dispute, Double suppliedConfidence) {
        if (suppliedConfidence != null) {
            if (suppliedConfidence.isNaN() || suppliedConfidence < 0.0 || suppliedConfidence > 1.0) {
                throw new IllegalArgumentException("confidence must be within [0, 1]: " + suppliedConfidence);
            }
            return ClassificationResult.of(suppliedConfidence, false);
        }

        if (!config.getClassification().isConfigured()) {
            return ClassificationResult.unavailable("classification service not configured");
        }

        Supplier<CompletableFuture<ClassificationResult>> remote =
                () -> CompletableFuture.supplyAsync(() -> client.classify(dispute), executor);
        Callable<ClassificationResult> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, remote);
        Callable<ClassificationResult> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);
        Callable<ClassificationResult> call = Retry.decorateCallable(retry, guarded);

        try {
            return call.call();
        } catch (Exception e) {
            return classifyFallback(dispute, e);
        }
    }

    private ClassificationResult classifyFallback(Dispute dispute, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String cause = describe(e);
        log.error("Classification for dispute {} unavailable: {}", dispute.getId(), cause);
        return ClassificationResult.unavailable("classification service " + cause);
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        if (e instanceof CallNotPermittedException) {
            return "circuit open";
        }
        return e != null ? e.getMessage() : "failed";
    }
}
