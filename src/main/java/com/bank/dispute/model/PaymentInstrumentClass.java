package com.bank.dispute.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Card funding class. Decides which regulatory regime governs the dispute.
 * Unknown funding values map to {@link #UNRECOGNIZED} instead of failing, so the
 * dispute can still be filed and handed to a specialist for classification.
 */
public enum PaymentInstrumentClass {
    DEBIT,
    CREDIT,
    PREPAID,
    UNRECOGNIZED;

    @JsonCreator
    public static PaymentInstrumentClass fromValue(String value) {
        if (value == null || value.isBlank()) return UNRECOGNIZED;
        for (PaymentInstrumentClass c : values()) {
            if (c.name().equalsIgnoreCase(value.trim())) return c;
        }
        return UNRECOGNIZED;
    }

    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }
}
