package com.bank.dispute.engine;

import com.bank.dispute.exception.DeadlineComputationException;
import com.bank.dispute.exception.DisputeClosedException;
import com.bank.dispute.exception.InvalidTransitionException;
import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.CreateDisputeRequest;
import com.bank.dispute.model.Deadline;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.EvidenceItem;
import com.bank.dispute.model.EvidencePackage;
import com.bank.dispute.model.PaymentInstrumentClass;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutingDecision;
import com.bank.dispute.model.RoutingDirective;
import com.bank.dispute.model.RoutingInfo;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Authoritative lifecycle of a dispute.
 *
 * <pre>
 * FILED -> AWAITING_EVIDENCE -> UNDER_REVIEW -> APPROVED | DENIED -> RESOLVED
 * FILED | AWAITING_EVIDENCE -> ESCALATED_SPECIALIST -> AWAITING_EVIDENCE | UNDER_REVIEW
 * UNDER_REVIEW -> ESCALATED_MANAGER -> APPROVED | DENIED
 * ESCALATED_MANAGER -> ESCALATED_SPECIALIST   (re-open, the only modeled cycle)
 * FILED -> CLOSED_REFUNDED
 * </pre>
 *
 * Every operation works on a deep copy and returns it; the dispute passed in is
 * never modified. Validation happens against the current status before any
 * mutation, and any exception thrown part-way discards the copy.
 */
@Component
public class DisputeStateMachine {

    private static final Logger log = LoggerFactory.getLogger(DisputeStateMachine.class);

    private final Map<EventType, TransitionHandler> handlers;
    private final DeadlineCalculator deadlineCalculator;
    private final ComplianceGuardrail guardrail;
    private final Tracer tracer;

    public DisputeStateMachine(List<TransitionHandler> handlerList,
                               DeadlineCalculator deadlineCalculator,
                               ComplianceGuardrail guardrail,
                               Tracer tracer) {
        this.handlers = new EnumMap<>(EventType.class);
        this.deadlineCalculator = deadlineCalculator;
        this.guardrail = guardrail;
        this.tracer = tracer;

        for (TransitionHandler handler : handlerList) {
            TransitionHandler previous = handlers.put(handler.getSupportedEventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.getSupportedEventType());
            }
            log.info("Registered transition handler: {} -> {}",
                    handler.getSupportedEventType(), handler.getClass().getSimpleName());
        }
    }

    /**
     * Build a new FILED dispute from an intake request. The narrative must
     * already have passed the guardrail.
     */
    public Dispute file(String disputeId, CreateDisputeRequest request, Instant asOf) {
        guardrail.requireClean(disputeId, "narrative", request.getNarrative());
        guardrail.requireClean(disputeId, "chargeReference", request.getChargeReference());

        Dispute dispute = Dispute.builder()
                .id(disputeId)
                .chargeReference(request.getChargeReference())
                .status(DisputeStatus.FILED)
                .reason(request.getReason())
                .amountMinor(request.getAmountMinor())
                .currency(request.getCurrency())
                .instrumentClass(request.getInstrumentClass() != null
                        ? request.getInstrumentClass() : PaymentInstrumentClass.UNRECOGNIZED)
                .createdAt(asOf)
                .accountAgeDays(request.getAccountAgeDays())
                .crossBorder(request.isCrossBorder())
                .pointOfSale(request.isPointOfSale())
                .billingCycleDays(request.getBillingCycleDays())
                .narrative(request.getNarrative())
                .lastTransitionAt(asOf)
                .version(1)
                .build();

        appendAudit(dispute, actorOrDefault(request.getActor(), "intake"), "FILED", String.format(
                "reason=%s amount=%d %s instrument=%s",
                dispute.getReason(), dispute.getAmountMinor(), dispute.getCurrency(), dispute.getInstrumentClass()),
                asOf);
        return dispute;
    }

    /**
     * Apply an event. All-or-nothing: on any exception {@code current} is unchanged
     * and nothing is returned.
     */
    public TransitionOutcome apply(Dispute current, DisputeEvent event, Instant asOf) {
        String disputeId = current.getId();
        DisputeStatus from = current.getStatus();

        if (from.isTerminal()) {
            throw new DisputeClosedException(disputeId, from, event.getType());
        }
        TransitionHandler handler = event.getType() != null ? handlers.get(event.getType()) : null;
        if (handler == null || !handler.canApply(current)) {
            throw new InvalidTransitionException(disputeId, from, event.getType(), validEvents(current));
        }
        if (event.getNote() != null) {
            guardrail.requireClean(disputeId, "note", event.getNote());
        }

        Span span = tracer.nextSpan()
                .name("dispute.transition." + event.getType())
                .tag("dispute.id", disputeId)
                .tag("dispute.from", from.name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Dispute working = current.copy();
            int auditBefore = working.getAuditTrail().size();

            TransitionEffect effect = handler.handle(working, event, asOf);
            DisputeStatus target = effect.getTargetStatus() != null ? effect.getTargetStatus() : from;
            RoutingDirective routing = effect.getRouting();

            working.setStatus(target);
            if (from == DisputeStatus.FILED && target != from && working.getInvestigationStartedAt() == null) {
                working.setInvestigationStartedAt(asOf);
            }

            DeadlineSchedule schedule = null;
            if (target != from && target.startsInvestigationClock()) {
                schedule = deadlineCalculator.compute(working, asOf);
                if (schedule.isRequiresManualClassification()) {
                    if (from != DisputeStatus.FILED && from != DisputeStatus.AWAITING_EVIDENCE) {
                        throw new DeadlineComputationException(disputeId,
                                "Instrument class is unrecognized; reclassify before moving to " + target);
                    }
                    log.warn("Dispute {} needs manual classification; escalating to specialist instead of {}",
                            disputeId, target);
                    target = DisputeStatus.ESCALATED_SPECIALIST;
                    working.setStatus(target);
                    routing = RoutingDirective.assign(QueueType.SPECIALIST, "requires manual classification");
                    appendAudit(working, "system", "DEADLINE_COMPUTATION_FAILURE",
                            "no regulation-backed deadlines for instrument " + working.getInstrumentClass(), asOf);
                    schedule = null;
                } else if (schedule.getDeadlines().isEmpty()) {
                    throw new DeadlineComputationException(disputeId, "No deadlines computed on entering " + target);
                } else {
                    mergeDeadlines(working, schedule.getDeadlines());
                }
            } else if (!working.getDeadlines().isEmpty() && working.getInstrumentClass().isRecognized()) {
                // Keep satisfied flags current as credits are issued and cases conclude
                schedule = deadlineCalculator.compute(working, asOf);
                mergeDeadlines(working, schedule.getDeadlines());
            }

            EvidencePackage evidencePackage = null;
            if (effect.isEmitEvidencePackage() && target == DisputeStatus.UNDER_REVIEW) {
                evidencePackage = buildEvidencePackage(working, asOf);
            }

            String detail = from == target ? "" : from + " -> " + target;
            if (effect.getDetail() != null) {
                detail = detail.isEmpty() ? effect.getDetail() : detail + "; " + effect.getDetail();
            }
            if (event.getNote() != null && !event.getNote().isBlank()) {
                detail = detail + (detail.isEmpty() ? "" : "; ") + "note: " + event.getNote();
            }
            appendAudit(working, actorOrDefault(event.getActor(), "system"), event.getType().name(), detail, asOf);

            working.setLastTransitionAt(asOf);
            working.setVersion(current.getVersion() + 1);

            span.tag("dispute.to", target.name());
            log.info("Dispute {} {}: {} -> {}", disputeId, event.getType(), from, target);

            return TransitionOutcome.builder()
                    .dispute(working)
                    .fromStatus(from)
                    .toStatus(target)
                    .routing(routing)
                    .evidencePackage(evidencePackage)
                    .deadlineSchedule(schedule)
                    .newAuditEntries(new ArrayList<>(working.getAuditTrail().subList(auditBefore, working.getAuditTrail().size())))
                    .build();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Record a routing decision on the dispute. A specialist assignment escalates
     * a case that has not reached review; a manager assignment escalates a case
     * under review.
     */
    public Dispute applyRouting(Dispute current, RoutingDecision decision, String actor, Instant asOf) {
        if (current.getStatus().isTerminal() && decision.getQueue().isActive()) {
            throw new DisputeClosedException(current.getId(), current.getStatus(), null);
        }
        Dispute working = current.copy();
        DisputeStatus from = working.getStatus();
        QueueType queue = decision.getQueue();

        if (queue == QueueType.SPECIALIST
                && (from == DisputeStatus.FILED || from == DisputeStatus.AWAITING_EVIDENCE)) {
            working.setStatus(DisputeStatus.ESCALATED_SPECIALIST);
        } else if (queue == QueueType.MANAGER && from == DisputeStatus.UNDER_REVIEW) {
            working.setStatus(DisputeStatus.ESCALATED_MANAGER);
        }
        if (from == DisputeStatus.FILED && working.getStatus() != from && working.getInvestigationStartedAt() == null) {
            working.setInvestigationStartedAt(asOf);
        }

        working.setRouting(RoutingInfo.builder()
                .queue(queue)
                .reason(decision.getReason())
                .assignedAt(queue.isActive() ? asOf : null)
                .build());

        String detail = "queue=" + queue + " reason=" + decision.getReason();
        if (working.getStatus() != from) {
            detail = from + " -> " + working.getStatus() + "; " + detail;
        }
        appendAudit(working, actorOrDefault(actor, "router"),
                decision.isDegraded() ? "ROUTED_DEGRADED" : (queue.isActive() ? "ROUTED" : "ROUTING_RELEASED"),
                detail, asOf);
        working.setVersion(current.getVersion() + 1);
        return working;
    }

    /**
     * Copy of the dispute with one rejection entry appended to its audit trail.
     * Allowed in every status, including terminal ones.
     */
    public Dispute recordRejection(Dispute current, String actor, String action, String detail, Instant asOf) {
        Dispute working = current.copy();
        appendAudit(working, actorOrDefault(actor, "system"), action, detail, asOf);
        return working;
    }

    /**
     * Flag the evidence items carried by a package the network accepted. Items
     * added after the package was built are left alone.
     *
     * @return the updated copy, or {@code current} itself when nothing changed
     */
    public Dispute markForwarded(Dispute current, EvidencePackage evidencePackage, Instant asOf) {
        if (current.getStatus().isTerminal()) {
            return current;
        }
        Dispute working = current.copy();
        int marked = 0;
        for (EvidenceItem item : working.getEvidence()) {
            if (!item.isForwardedToNetwork() && carries(evidencePackage, item)) {
                item.setForwardedToNetwork(true);
                marked++;
            }
        }
        if (marked == 0) {
            return current;
        }
        appendAudit(working, "network-submitter", "EVIDENCE_FORWARDED",
                marked + " evidence item(s) accepted by the network", asOf);
        working.setVersion(current.getVersion() + 1);
        return working;
    }

    private static boolean carries(EvidencePackage evidencePackage, EvidenceItem item) {
        for (EvidenceItem sent : evidencePackage.getEvidence()) {
            if (Objects.equals(sent.getType(), item.getType())
                    && Objects.equals(sent.getSubmittedAt(), item.getSubmittedAt())
                    && Objects.equals(sent.getContent(), item.getContent())) {
                return true;
            }
        }
        return false;
    }

    public Set<EventType> validEvents(Dispute dispute) {
        if (dispute.getStatus().isTerminal()) {
            return EnumSet.noneOf(EventType.class);
        }
        Set<EventType> valid = EnumSet.noneOf(EventType.class);
        for (TransitionHandler handler : handlers.values()) {
            if (handler.canApply(dispute)) {
                valid.add(handler.getSupportedEventType());
            }
        }
        return valid;
    }

    private void mergeDeadlines(Dispute working, List<Deadline> computed) {
        Map<String, Deadline> byLabel = new LinkedHashMap<>();
        for (Deadline existing : working.getDeadlines()) {
            byLabel.put(existing.getLabel(), existing);
        }
        for (Deadline deadline : computed) {
            byLabel.put(deadline.getLabel(), deadline);
        }
        working.setDeadlines(new ArrayList<>(byLabel.values()));
    }

    private EvidencePackage buildEvidencePackage(Dispute working, Instant asOf) {
        List<EvidenceItem> forwarded = new ArrayList<>();
        for (EvidenceItem item : working.getEvidence()) {
            forwarded.add(item.toBuilder().build());
        }
        List<Deadline> summary = new ArrayList<>();
        for (Deadline deadline : working.getDeadlines()) {
            summary.add(deadline.toBuilder().build());
        }
        return EvidencePackage.builder()
                .disputeId(working.getId())
                .chargeReference(working.getChargeReference())
                .reason(working.getReason())
                .amountMinor(working.getAmountMinor())
                .currency(working.getCurrency())
                .evidence(forwarded)
                .deadlineSummary(summary)
                .emittedAt(asOf)
                .build();
    }

    private void appendAudit(Dispute working, String actor, String action, String detail, Instant asOf) {
        working.getAuditTrail().add(AuditEntry.builder()
                .disputeId(working.getId())
                .sequence(working.nextAuditSequence())
                .actor(guardrail.sanitize(actor))
                .action(action)
                .timestamp(asOf)
                .detail(guardrail.sanitize(detail))
                .build());
    }

    private static String actorOrDefault(String actor, String fallback) {
        return actor == null || actor.isBlank() ? fallback : actor;
    }
}
