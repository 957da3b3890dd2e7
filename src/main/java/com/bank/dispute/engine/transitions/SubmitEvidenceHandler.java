package com.bank.dispute.engine.transitions;

import com.bank.dispute.config.WorkflowConfig;
import com.bank.dispute.engine.ComplianceGuardrail;
import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.exception.EvidenceLimitExceededException;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.EvidenceItem;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Attaches one evidence item. Status does not change.
 *
 * The content is guardrail-checked before the size bounds, so card data is
 * reported as a compliance violation even when the item is also oversized.
 * The audit detail records only the type and size, never the content.
 */
@Component
public class SubmitEvidenceHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES =
            EnumSet.of(DisputeStatus.AWAITING_EVIDENCE, DisputeStatus.ESCALATED_SPECIALIST);

    private final ComplianceGuardrail guardrail;
    private final WorkflowConfig config;

    public SubmitEvidenceHandler(ComplianceGuardrail guardrail, WorkflowConfig config) {
        this.guardrail = guardrail;
        this.config = config;
    }

    @Override
    public EventType getSupportedEventType() {
        return EventType.SUBMIT_EVIDENCE;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        String content = event.getEvidenceContent();
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("SUBMIT_EVIDENCE requires evidenceContent");
        }
        String type = event.getEvidenceType() == null || event.getEvidenceType().isBlank()
                ? "GENERAL" : event.getEvidenceType().trim();

        guardrail.requireClean(working.getId(), "evidenceType", type);
        guardrail.requireClean(working.getId(), "evidenceContent", content);

        int size = content.getBytes(StandardCharsets.UTF_8).length;
        int count = working.getEvidence().size() + 1;
        if (count > config.getMaxEvidenceItems()) {
            throw new EvidenceLimitExceededException(working.getId(), "item count",
                    config.getMaxEvidenceItems(), count);
        }
        if (size > config.getMaxEvidenceItemBytes()) {
            throw new EvidenceLimitExceededException(working.getId(), "item size",
                    config.getMaxEvidenceItemBytes(), size);
        }
        long total = (long) working.totalEvidenceBytes() + size;
        if (total > config.getMaxEvidenceTotalBytes()) {
            throw new EvidenceLimitExceededException(working.getId(), "total size",
                    config.getMaxEvidenceTotalBytes(), total);
        }

        working.getEvidence().add(EvidenceItem.builder()
                .type(type)
                .content(content)
                .sizeBytes(size)
                .submittedAt(asOf)
                .submittedBy(event.getActor())
                .forwardedToNetwork(false)
                .build());

        return TransitionEffect.builder()
                .detail(String.format("evidence type=%s bytes=%d items=%d", type, size, count))
                .build();
    }
}
