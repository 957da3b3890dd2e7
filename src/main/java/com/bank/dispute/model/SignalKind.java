package com.bank.dispute.model;

public enum SignalKind {
    SLA_BREACH,
    QUEUE_BACKLOG,
    DEADLINE_MISSED,
    GUARDRAIL_VIOLATION
}
