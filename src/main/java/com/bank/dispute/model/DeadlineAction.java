package com.bank.dispute.model;

public enum DeadlineAction {
    PROVISIONAL_CREDIT,
    ACKNOWLEDGMENT,
    RESOLUTION
}
