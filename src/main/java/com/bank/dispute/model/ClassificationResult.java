package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer from the classification/scoring collaborator. {@code available == false}
 * marks a degraded answer produced when the collaborator could not be reached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResult {
    private double confidence;
    private boolean requiresManualClassification;
    private boolean available;
    private String unavailableReason;

    public static ClassificationResult of(double confidence, boolean requiresManualClassification) {
        return new ClassificationResult(confidence, requiresManualClassification, true, null);
    }

    public static ClassificationResult unavailable(String reason) {
        return new ClassificationResult(0.0, false, false, reason);
    }
}
