package com.bank.dispute.service;

import com.bank.dispute.model.EvidencePackage;

/**
 * Hands an evidence package to the card network.
 */
public interface NetworkSubmissionClient {

    boolean isAvailable();

    void submit(EvidencePackage evidencePackage);
}
