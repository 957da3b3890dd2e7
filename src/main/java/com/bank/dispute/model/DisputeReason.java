package com.bank.dispute.model;

public enum DisputeReason {
    UNAUTHORIZED,
    DUPLICATE,
    GOODS_NOT_RECEIVED,
    NOT_AS_DESCRIBED,
    CREDIT_NOT_PROCESSED,
    SUBSCRIPTION_CANCELLED,
    UNRECOGNIZED,
    GENERAL
}
