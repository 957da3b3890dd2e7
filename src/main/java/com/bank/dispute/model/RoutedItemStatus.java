package com.bank.dispute.model;

public enum RoutedItemStatus {
    QUEUED,
    ACKNOWLEDGED,
    ACTIONED;

    public boolean isOpen() {
        return this != ACTIONED;
    }
}
