package dev.univer.notoc.service;

import dev.univer.notoc.model.TxKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Tells a linked debtor about a new entry. Runs only after the ledger write committed;
 * a failed send is logged and never reaches the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebtorNotificationListener {
    private final Notifier notifier;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRecorded(TxRecordedEvent event) {
        try {
            notifier.notify(event.debtorExternalId(), render(event));
        } catch (RuntimeException e) {
            log.warn("Failed to notify {} about tx {}: {}", event.debtorExternalId(), event.transactionId(), e.getMessage());
        }
    }

    static String render(TxRecordedEvent e) {
        String amount = e.amount().stripTrailingZeros().toPlainString();
        String reason = (e.note() == null || e.note().isBlank()) ? "" : ". Note: " + e.note();
        return e.kind() == TxKind.DEBT
               ? "🔔 " + e.creditorName() + " recorded a debt for you: " + amount + reason
               : "🔔 " + e.creditorName() + " recorded your repayment: " + amount + reason;
    }
}
