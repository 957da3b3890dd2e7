package com.bank.dispute.service;

import com.bank.dispute.config.WorkflowConfig;
import com.bank.dispute.exception.DuplicateRequestException;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.IdempotencyRecord;
import com.bank.dispute.model.TransitionResult;
import com.bank.dispute.repository.IdempotencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Remembers transition results per (dispute, idempotency key) for the configured
 * window. A repeat of the same event returns the stored result; reusing the key
 * for another event is a {@link DuplicateRequestException}.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final IdempotencyRepository repository;
    private final WorkflowConfig config;

    public IdempotencyService(IdempotencyRepository repository, WorkflowConfig config) {
        this.repository = repository;
        this.config = config;
    }

    public Optional<TransitionResult> replay(String disputeId, String idempotencyKey,
                                             EventType eventType, Instant now) {
        IdempotencyRecord record = repository.find(disputeId, idempotencyKey);
        if (record == null) {
            return Optional.empty();
        }
        if (now.toEpochMilli() - record.getStoredAt() > window().toMillis()) {
            log.debug("Idempotency key {} for dispute {} is past its window", idempotencyKey, disputeId);
            return Optional.empty();
        }
        if (record.getEventType() != eventType) {
            throw new DuplicateRequestException(disputeId, idempotencyKey, record.getEventType(), eventType);
        }
        log.info("Replaying stored {} result for dispute {} key {}", eventType, disputeId, idempotencyKey);
        return Optional.of(record.getResult());
    }

    public void remember(String disputeId, String idempotencyKey, EventType eventType,
                         DisputeStatus sourceStatus, TransitionResult result, Instant now) {
        repository.save(IdempotencyRecord.builder()
                .disputeId(disputeId)
                .idempotencyKey(idempotencyKey)
                .eventType(eventType)
                .sourceStatus(sourceStatus)
                .result(result)
                .storedAt(now.toEpochMilli())
                .build(), (int) window().toSeconds());
    }

    private Duration window() {
        return Duration.ofHours(config.getIdempotencyWindowHours());
    }
}
