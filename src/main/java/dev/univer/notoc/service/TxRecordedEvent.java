package dev.univer.notoc.service;

import dev.univer.notoc.model.TxKind;

import java.math.BigDecimal;

/** Published inside the appending transaction, handled once it has committed. */
public record TxRecordedEvent(Long transactionId,
                              Long debtorExternalId,
                              String creditorName,
                              BigDecimal amount,
                              TxKind kind,
                              String note) {
}
