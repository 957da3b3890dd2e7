package com.bank.dispute.engine;

import com.bank.dispute.config.RoutingConfig;
import com.bank.dispute.model.ClassificationResult;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.PaymentInstrumentClass;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutingDecision;
import org.springframework.stereotype.Component;

/**
 * Ordered routing rules; the first match wins.
 *
 * 1. Manual classification needed, or a credit card dispute whose reason is
 *    not automatable: SPECIALIST.
 * 2. Scoring unavailable, confidence below threshold, or amount above the
 *    high-value threshold: MANAGER.
 * 3. Otherwise straight-through: AUTO.
 */
@Component
public class RoutingRules {

    private final RoutingConfig config;

    public RoutingRules(RoutingConfig config) {
        this.config = config;
    }

    public RoutingDecision decide(Dispute dispute, ClassificationResult classification) {
        boolean manualClassification = !dispute.getInstrumentClass().isRecognized()
                || (classification != null && classification.isRequiresManualClassification());
        if (manualClassification) {
            return RoutingDecision.to(QueueType.SPECIALIST, "requires manual classification");
        }
        if (dispute.getInstrumentClass() == PaymentInstrumentClass.CREDIT
                && !config.getAutomatableCreditReasons().contains(dispute.getReason())) {
            return RoutingDecision.to(QueueType.SPECIALIST,
                    "credit dispute with non-automatable reason " + dispute.getReason());
        }

        if (classification == null || !classification.isAvailable()) {
            String why = classification != null ? classification.getUnavailableReason() : "no classification";
            return new RoutingDecision(QueueType.MANAGER, "DownstreamUnavailable: " + why, true);
        }
        if (classification.getConfidence() < config.getConfidenceThreshold()) {
            return RoutingDecision.to(QueueType.MANAGER, String.format(
                    "confidence %.2f below threshold %.2f",
                    classification.getConfidence(), config.getConfidenceThreshold()));
        }
        if (dispute.getAmountMinor() > config.getHighValueThresholdMinor()) {
            return RoutingDecision.to(QueueType.MANAGER, String.format(
                    "amount %d exceeds high-value threshold %d",
                    dispute.getAmountMinor(), config.getHighValueThresholdMinor()));
        }

        return RoutingDecision.to(QueueType.AUTO, "straight-through");
    }
}
