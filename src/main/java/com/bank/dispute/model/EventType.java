package com.bank.dispute.model;

public enum EventType {
    REQUEST_EVIDENCE,
    SUBMIT_EVIDENCE,
    BEGIN_REVIEW,
    ESCALATE_TO_SPECIALIST,
    ESCALATE_TO_MANAGER,
    RECLASSIFY_INSTRUMENT,
    ISSUE_PROVISIONAL_CREDIT,
    REFUND,
    APPROVE,
    DENY,
    NETWORK_OUTCOME,
    REOPEN,
    ACKNOWLEDGE,
    RESOLVE
}
