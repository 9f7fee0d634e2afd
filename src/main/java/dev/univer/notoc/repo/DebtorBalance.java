package dev.univer.notoc.repo;

import java.math.BigDecimal;

/** Row of a grouped balance aggregation. A debtor without entries has balance zero. */
public record DebtorBalance(String debtorName, Long debtorId, BigDecimal balance) {
    public DebtorBalance {
        if (balance == null) balance = BigDecimal.ZERO;
    }
}
