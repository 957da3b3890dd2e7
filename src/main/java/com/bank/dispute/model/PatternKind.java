package com.bank.dispute.model;

public enum PatternKind {
    CARD_NUMBER("card-number-like data detected", "[REDACTED-PAN]"),
    CARD_VERIFICATION_CODE("card-verification-code-like data detected", "[REDACTED-CVV]"),
    PIN("PIN-like data detected", "[REDACTED-PIN]");

    private final String category;
    private final String mask;

    PatternKind(String category, String mask) {
        this.category = category;
        this.mask = mask;
    }

    /** Actionable reason shown to callers; never contains the matched text. */
    public String getCategory() {
        return category;
    }

    public String getMask() {
        return mask;
    }
}
