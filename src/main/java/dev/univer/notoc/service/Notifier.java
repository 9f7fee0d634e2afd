package dev.univer.notoc.service;

/** Outbound message to a person outside the ledger. Best effort: callers log failures and move on. */
public interface Notifier {
    void notify(Long externalId, String message);
}
