package com.bank.dispute.service;

import com.bank.dispute.model.ClassificationResult;
import com.bank.dispute.model.Dispute;

/**
 * External scoring of a dispute. Implementations throw
 * {@link com.bank.dispute.exception.DownstreamUnavailableException} when the
 * collaborator cannot answer.
 */
public interface ClassificationClient {

    ClassificationResult classify(Dispute dispute);
}
