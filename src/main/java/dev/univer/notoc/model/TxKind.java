package dev.univer.notoc.model;

import java.math.BigDecimal;

public enum TxKind {
    /** The debtor owes the user more. */
    DEBT,
    /** The debtor paid back (or the user borrowed). */
    CREDIT;

    public BigDecimal signed(BigDecimal amount) {
        return this == DEBT ? amount : amount.negate();
    }
}
