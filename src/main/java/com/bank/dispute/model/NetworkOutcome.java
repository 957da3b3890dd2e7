package com.bank.dispute.model;

public enum NetworkOutcome {
    ACCEPTED,
    REJECTED,
    TIMEOUT
}
