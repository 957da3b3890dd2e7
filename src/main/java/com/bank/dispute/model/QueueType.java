package com.bank.dispute.model;

public enum QueueType {
    NONE,
    AUTO,
    SPECIALIST,
    MANAGER;

    public boolean isActive() {
        return this != NONE;
    }

    /** Queues staffed by humans; only these carry an acknowledgment SLA. */
    public boolean isHumanQueue() {
        return this == SPECIALIST || this == MANAGER;
    }
}
