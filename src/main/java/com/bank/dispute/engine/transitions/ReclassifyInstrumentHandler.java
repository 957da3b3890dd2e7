package com.bank.dispute.engine.transitions;

import com.bank.dispute.engine.TransitionEffect;
import com.bank.dispute.engine.TransitionHandler;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.PaymentInstrumentClass;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Specialist determination of the funding class. Until this happens an
 * unrecognized dispute cannot enter an investigation status.
 */
@Component
public class ReclassifyInstrumentHandler implements TransitionHandler {

    private static final Set<DisputeStatus> SOURCES = EnumSet.of(DisputeStatus.ESCALATED_SPECIALIST);

    @Override
    public EventType getSupportedEventType() {
        return EventType.RECLASSIFY_INSTRUMENT;
    }

    @Override
    public Set<DisputeStatus> getSourceStatuses() {
        return SOURCES;
    }

    @Override
    public TransitionEffect handle(Dispute working, DisputeEvent event, Instant asOf) {
        PaymentInstrumentClass target = event.getInstrumentClass();
        if (target == null || !target.isRecognized()) {
            throw new IllegalArgumentException(
                    "RECLASSIFY_INSTRUMENT requires a recognized instrumentClass (DEBIT, CREDIT or PREPAID)");
        }
        PaymentInstrumentClass previous = working.getInstrumentClass();
        working.setInstrumentClass(target);
        return TransitionEffect.builder()
                .detail("instrument " + previous + " -> " + target)
                .build();
    }
}
