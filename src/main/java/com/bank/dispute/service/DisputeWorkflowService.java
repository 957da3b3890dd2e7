package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.engine.ComplianceGuardrail;
import com.bank.dispute.engine.DeadlineCalculator;
import com.bank.dispute.engine.DisputeStateMachine;
import com.bank.dispute.engine.RoutingRules;
import com.bank.dispute.engine.TransitionOutcome;
import com.bank.dispute.exception.ComplianceViolationException;
import com.bank.dispute.exception.DisputeNotFoundException;
import com.bank.dispute.exception.DisputeWorkflowException;
import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.ClassificationResult;
import com.bank.dispute.model.CreateDisputeRequest;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.EvidencePackage;
import com.bank.dispute.model.NetworkOutcome;
import com.bank.dispute.model.PatternKind;
import com.bank.dispute.model.RoutingDecision;
import com.bank.dispute.model.RoutingDirective;
import com.bank.dispute.model.Signal;
import com.bank.dispute.model.SignalKind;
import com.bank.dispute.model.TransitionResult;
import com.bank.dispute.repository.DisputeRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates one request end to end: per-dispute lock, idempotency, state
 * machine, routing, persistence of the dispute and its audit entries, and the
 * hand-off of evidence packages to the network.
 * <p>
 * Commit order is dispute record, then audit entries, then work queues. Queue
 * changes are collected while the transition is worked out and only applied once
 * the dispute has been saved, so a failed save leaves nothing behind.
 */
@Service
public class DisputeWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(DisputeWorkflowService.class);

    private static final String ROUTER = "router";
    private static final String NETWORK_SUBMITTER = "network-submitter";

    static final String OUTCOME_RETRY = "network-outcome";

    private final DisputeStateMachine stateMachine;
    private final DeadlineCalculator deadlineCalculator;
    private final ComplianceGuardrail guardrail;
    private final RoutingRules routingRules;
    private final RoutingEngine routingEngine;
    private final ClassificationService classificationService;
    private final NetworkSubmissionService networkSubmissionService;
    private final SignalDispatcher signalDispatcher;
    private final AuditLogService auditLogService;
    private final IdempotencyService idempotencyService;
    private final DisputeLockRegistry lockRegistry;
    private final DisputeRepository disputeRepository;
    private final MetricsConfig metricsConfig;
    private final Retry outcomeRetry;
    private final Clock clock;

    public DisputeWorkflowService(DisputeStateMachine stateMachine,
                                  DeadlineCalculator deadlineCalculator,
                                  ComplianceGuardrail guardrail,
                                  RoutingRules routingRules,
                                  RoutingEngine routingEngine,
                                  ClassificationService classificationService,
                                  NetworkSubmissionService networkSubmissionService,
                                  SignalDispatcher signalDispatcher,
                                  AuditLogService auditLogService,
                                  IdempotencyService idempotencyService,
                                  DisputeLockRegistry lockRegistry,
                                  DisputeRepository disputeRepository,
                                  MetricsConfig metricsConfig,
                                  RetryRegistry retryRegistry,
                                  Clock clock) {
        this.stateMachine = stateMachine;
        this.deadlineCalculator = deadlineCalculator;
        this.guardrail = guardrail;
        this.routingRules = routingRules;
        this.routingEngine = routingEngine;
        this.classificationService = classificationService;
        this.networkSubmissionService = networkSubmissionService;
        this.signalDispatcher = signalDispatcher;
        this.auditLogService = auditLogService;
        this.idempotencyService = idempotencyService;
        this.lockRegistry = lockRegistry;
        this.disputeRepository = disputeRepository;
        this.metricsConfig = metricsConfig;
        this.outcomeRetry = retryRegistry.retry(OUTCOME_RETRY);
        this.clock = clock;
    }

    /**
     * File a new dispute from intake and route it. A narrative carrying card data
     * is refused; the refusal is audited under the id the dispute would have had.
     */
    @Observed(name = "dispute.create", contextualName = "create-dispute")
    public Dispute createDispute(CreateDisputeRequest request) {
        validate(request);
        Instant now = clock.instant();
        String disputeId = "DSP-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);

        Dispute filed;
        try {
            filed = stateMachine.file(disputeId, request, now);
        } catch (ComplianceViolationException e) {
            rejectIntake(disputeId, request.getActor(), e, now);
            throw e;
        }

        return lockRegistry.withLock(disputeId, () -> {
            ClassificationResult classification = classificationService.classify(filed, request.getConfidence());
            List<Runnable> queueWork = new ArrayList<>();
            Dispute routed = route(filed, routingRules.decide(filed, classification), now, queueWork);
            persist(null, routed);
            queueWork.forEach(Runnable::run);
            metricsConfig.recordTransition("FILE", "applied");
            log.info("Dispute {} filed: reason={} instrument={} queue={} status={}",
                    disputeId, routed.getReason(), routed.getInstrumentClass(),
                    routed.getRouting().getQueue(), routed.getStatus());
            return outbound(routed);
        });
    }

    /**
     * Apply a lifecycle event. A repeated idempotency key for the same event returns
     * the stored result without touching the dispute or its audit trail.
     */
    @Observed(name = "dispute.apply_event", contextualName = "apply-dispute-event")
    public TransitionResult applyEvent(String disputeId, DisputeEvent event) {
        if (event.getType() == null) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (event.getIdempotencyKey() == null || event.getIdempotencyKey().isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required for " + event.getType());
        }
        Double confidence = event.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }

        return lockRegistry.withLock(disputeId, () -> {
            Instant now = clock.instant();
            Dispute current = load(disputeId);

            Optional<TransitionResult> replay =
                    idempotencyService.replay(disputeId, event.getIdempotencyKey(), event.getType(), now);
            if (replay.isPresent()) {
                metricsConfig.recordTransition(event.getType().name(), "replayed");
                return replay.get();
            }

            TransitionOutcome outcome;
            try {
                outcome = stateMachine.apply(current, event, now);
            } catch (ComplianceViolationException e) {
                recordRejection(current, event, "COMPLIANCE_REJECTED", e.getMessage(), now);
                raiseGuardrailSignal(disputeId, e, now);
                throw e;
            } catch (DisputeWorkflowException e) {
                recordRejection(current, event, e.getErrorCode().name(), e.getMessage(), now);
                throw e;
            } catch (IllegalArgumentException e) {
                recordRejection(current, event, "INVALID_EVENT", e.getMessage(), now);
                throw e;
            }

            List<Runnable> queueWork = new ArrayList<>();
            Dispute updated = applyDirective(outcome.getDispute(), outcome.getRouting(), event.getConfidence(), now, queueWork);
            persist(current, updated);
            queueWork.forEach(Runnable::run);

            TransitionResult result = TransitionResult.builder()
                    .disputeId(disputeId)
                    .eventType(event.getType())
                    .fromStatus(outcome.getFromStatus())
                    .toStatus(updated.getStatus())
                    .queue(updated.getRouting().getQueue())
                    .appliedAt(now)
                    .dispute(outbound(updated))
                    .build();
            idempotencyService.remember(disputeId, event.getIdempotencyKey(), event.getType(),
                    outcome.getFromStatus(), result, now);
            metricsConfig.recordTransition(event.getType().name(), "applied");

            if (outcome.getEvidencePackage() != null) {
                submitToNetwork(outcome.getEvidencePackage());
            }
            return result;
        });
    }

    public TransitionResult recordNetworkOutcome(String disputeId, NetworkOutcome networkOutcome,
                                                 String idempotencyKey, String actor) {
        return applyEvent(disputeId, DisputeEvent.builder()
                .type(EventType.NETWORK_OUTCOME)
                .networkOutcome(networkOutcome)
                .idempotencyKey(idempotencyKey)
                .actor(actor != null ? actor : "card-network")
                .build());
    }

    public TransitionResult acknowledge(String disputeId, String idempotencyKey, String actor) {
        return applyEvent(disputeId, DisputeEvent.builder()
                .type(EventType.ACKNOWLEDGE)
                .idempotencyKey(idempotencyKey)
                .actor(actor)
                .build());
    }

    public Dispute getDispute(String disputeId) {
        return outbound(load(disputeId));
    }

    /**
     * Deadlines as they stand at {@code asOf}; read-only.
     */
    public DeadlineSchedule computeDeadlines(String disputeId, Instant asOf) {
        return deadlineCalculator.compute(load(disputeId), asOf != null ? asOf : clock.instant());
    }

    public List<String> validEvents(String disputeId) {
        return stateMachine.validEvents(load(disputeId)).stream().map(Enum::name).toList();
    }

    private Dispute applyDirective(Dispute dispute, RoutingDirective directive, Double confidence, Instant now,
                                   List<Runnable> queueWork) {
        switch (directive.getKind()) {
            case EVALUATE -> {
                ClassificationResult classification = classificationService.classify(dispute, confidence);
                return route(dispute, routingRules.decide(dispute, classification), now, queueWork);
            }
            case ASSIGN -> {
                return route(dispute, RoutingDecision.to(directive.getQueue(), directive.getReason()), now, queueWork);
            }
            case REOPEN -> {
                RoutingDecision decision = RoutingDecision.to(directive.getQueue(), directive.getReason());
                Dispute reopened = stateMachine.applyRouting(dispute, decision, ROUTER, now);
                queueWork.add(() -> {
                    routingEngine.reopen(reopened, directive.getQueue(), directive.getReason(), now);
                    metricsConfig.recordRoutingDecision(directive.getQueue().name(), false);
                });
                return reopened;
            }
            case RELEASE -> {
                String disputeId = dispute.getId();
                if (dispute.getStatus().isTerminal()) {
                    queueWork.add(() -> routingEngine.retire(disputeId, now));
                } else {
                    queueWork.add(() -> routingEngine.release(disputeId, now));
                }
                if (dispute.getRouting().getQueue().isActive()) {
                    return stateMachine.applyRouting(dispute, RoutingDecision.release(directive.getReason()), ROUTER, now);
                }
                return dispute;
            }
            case ACKNOWLEDGE -> {
                queueWork.add(() -> routingEngine.acknowledge(dispute.getId(), now));
                return dispute;
            }
            default -> {
                return dispute;
            }
        }
    }

    private Dispute route(Dispute dispute, RoutingDecision decision, Instant now, List<Runnable> queueWork) {
        Dispute routed = stateMachine.applyRouting(dispute, decision, ROUTER, now);
        queueWork.add(() -> {
            routingEngine.assign(routed, decision.getQueue(), decision.getReason(), now);
            metricsConfig.recordRoutingDecision(decision.getQueue().name(), decision.isDegraded());
        });
        if (decision.isDegraded()) {
            log.warn("Dispute {} routed to {} in degraded mode: {}", dispute.getId(), decision.getQueue(), decision.getReason());
        }
        return routed;
    }

    /**
     * Settles the submission on the thread that completes it. Items are
     * flagged as forwarded only after the network accepted them; a failed or
     * aborted submission is recorded as a network timeout.
     */
    private void submitToNetwork(EvidencePackage evidencePackage) {
        String disputeId = evidencePackage.getDisputeId();
        networkSubmissionService.submit(evidencePackage).whenComplete((status, error) -> {
            try {
                if (error != null) {
                    log.error("Network submission for dispute {} aborted", disputeId, error);
                    recordNetworkTimeout(evidencePackage);
                } else if (status == NetworkSubmissionService.SubmissionStatus.SUBMITTED) {
                    markForwarded(evidencePackage);
                } else if (status == NetworkSubmissionService.SubmissionStatus.FAILED) {
                    recordNetworkTimeout(evidencePackage);
                }
            } catch (RuntimeException e) {
                log.error("Could not settle network submission for dispute {}", disputeId, e);
            }
        });
    }

    private void markForwarded(EvidencePackage evidencePackage) {
        String disputeId = evidencePackage.getDisputeId();
        Retry.decorateRunnable(outcomeRetry, () -> lockRegistry.withLock(disputeId, () -> {
            Dispute current = load(disputeId);
            Dispute marked = stateMachine.markForwarded(current, evidencePackage, clock.instant());
            if (marked != current) {
                persist(current, marked);
            }
            return marked;
        })).run();
    }

    private void recordNetworkTimeout(EvidencePackage evidencePackage) {
        String key = "network-timeout:" + evidencePackage.getEmittedAt().toEpochMilli();
        try {
            Retry.decorateRunnable(outcomeRetry, () -> recordNetworkOutcome(
                    evidencePackage.getDisputeId(), NetworkOutcome.TIMEOUT, key, NETWORK_SUBMITTER)).run();
        } catch (DisputeWorkflowException e) {
            log.warn("Network timeout not applicable to dispute {}: {}", evidencePackage.getDisputeId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record network timeout for dispute {}", evidencePackage.getDisputeId(), e);
        }
    }

    private void recordRejection(Dispute current, DisputeEvent event, String action, String reason, Instant now) {
        String detail = event.getType() + " rejected in " + current.getStatus() + ": " + reason;
        Dispute rejected = stateMachine.recordRejection(current, event.getActor(), action, detail, now);
        persist(current, rejected);
        metricsConfig.recordTransition(event.getType().name(), "rejected");
    }

    private void rejectIntake(String disputeId, String actor, ComplianceViolationException e, Instant now) {
        auditLogService.append(List.of(AuditEntry.builder()
                .disputeId(disputeId)
                .sequence(1)
                .actor(actor != null && !actor.isBlank() ? guardrail.sanitize(actor) : "intake")
                .action("INTAKE_REJECTED")
                .timestamp(now)
                .detail(e.getMessage())
                .build()));
        raiseGuardrailSignal(disputeId, e, now);
        log.warn("Intake for dispute {} rejected: {}", disputeId, e.getMessage());
    }

    private void raiseGuardrailSignal(String disputeId, ComplianceViolationException e, Instant now) {
        for (PatternKind kind : e.getKinds()) {
            metricsConfig.recordGuardrailRejection(kind.name());
        }
        signalDispatcher.publish(Signal.builder()
                .disputeId(disputeId)
                .kind(SignalKind.GUARDRAIL_VIOLATION)
                .detail(e.getMessage())
                .occurredAt(now)
                .build());
    }

    private void persist(Dispute before, Dispute after) {
        disputeRepository.save(after);
        int known = before != null ? before.getAuditTrail().size() : 0;
        List<AuditEntry> trail = after.getAuditTrail();
        if (trail.size() > known) {
            auditLogService.append(trail.subList(known, trail.size()));
        }
    }

    private Dispute load(String disputeId) {
        Dispute dispute = disputeRepository.findById(disputeId);
        if (dispute == null) {
            throw new DisputeNotFoundException(disputeId);
        }
        return dispute;
    }

    private Dispute outbound(Dispute dispute) {
        Dispute view = dispute.copy();
        view.setNarrative(guardrail.sanitize(view.getNarrative()));
        view.getEvidence().forEach(e -> e.setContent(guardrail.sanitize(e.getContent())));
        return view;
    }

    private static void validate(CreateDisputeRequest request) {
        if (request.getChargeReference() == null || request.getChargeReference().isBlank()) {
            throw new IllegalArgumentException("chargeReference is required");
        }
        if (request.getReason() == null) {
            throw new IllegalArgumentException("reason is required");
        }
        if (request.getAmountMinor() <= 0) {
            throw new IllegalArgumentException("amountMinor must be positive");
        }
        if (request.getCurrency() == null || !request.getCurrency().matches("[A-Z]{3}")) {
            throw new IllegalArgumentException("currency must be an ISO 4217 code");
        }
        if (request.getNarrative() == null || request.getNarrative().isBlank()) {
            throw new IllegalArgumentException("narrative is required");
        }
    }
}
