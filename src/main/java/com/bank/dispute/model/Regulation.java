package com.bank.dispute.model;

/**
 * Regulatory regime a deadline derives from.
 * REG_E (regime A) covers debit and prepaid cards, REG_Z (regime B) covers credit cards.
 */
public enum Regulation {
    REG_E("A"),
    REG_Z("B");

    private final String regime;

    Regulation(String regime) {
        this.regime = regime;
    }

    public String getRegime() {
        return regime;
    }

    public static Regulation forInstrument(PaymentInstrumentClass instrumentClass) {
        if (instrumentClass == null) return null;
        return switch (instrumentClass) {
            case DEBIT, PREPAID -> REG_E;
            case CREDIT -> REG_Z;
            case UNRECOGNIZED -> null;
        };
    }
}
