package dev.univer.notoc.service;

import dev.univer.notoc.config.NotocProperties;
import dev.univer.notoc.match.Candidate;
import dev.univer.notoc.match.Resolution;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.model.PendingDecision;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.model.TxKind;
import dev.univer.notoc.model.User;
import dev.univer.notoc.repo.DebtorBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resolve-then-append in one unit of work. When the name is ambiguous nothing is written
 * to the ledger; the request is parked as a {@link PendingDecision} and the candidates go back
 * to the caller, who continues with {@link #continueWithDebtor} or {@link #continueWithNewDebtor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordService {
    private final UserService userService;
    private final DebtorResolver resolver;
    private final DebtorService debtorService;
    private final LedgerService ledgerService;
    private final PendingDecisionService pendingDecisionService;
    private final NotocProperties props;

    @Transactional
    public RecordOutcome record(RecordCommand cmd) {
        LedgerService.validateAmount(cmd.amount());
        String query = DebtorResolver.requireName(cmd.nameQuery());
        User user = userService.getOrCreate(cmd.userExternalId(), cmd.userName(), cmd.userHandle());

        Resolution r = resolver.resolve(user.getId(), query, props.getMatch().getThreshold());
        switch (r.kind()) {
            case ALIAS, NAME -> {
                return append(user, r.exactMatch(), cmd.amount(), cmd.kind(), cmd.note(), cmd.dueDate(), cmd.groupTag());
            }
            case FUZZY -> {
                pendingDecisionService.save(PendingDecision.builder()
                                                           .userExternalId(cmd.userExternalId())
                                                           .sessionToken(cmd.sessionToken())
                                                           .nameQuery(query)
                                                           .amount(cmd.amount())
                                                           .kind(cmd.kind())
                                                           .note(cmd.note())
                                                           .dueDate(cmd.dueDate())
                                                           .groupTag(cmd.groupTag())
                                                           .build());
                log.debug("'{}' is ambiguous for user {}, waiting for a choice", query, user.getId());
                return RecordOutcome.pending(r.candidates());
            }
            default -> {
                Debtor created = debtorService.getOrCreate(user.getId(), query);
                return append(user, created, cmd.amount(), cmd.kind(), cmd.note(), cmd.dueDate(), cmd.groupTag());
            }
        }
    }

    /**
     * Records against the debtor linked to a real account ({@code debtorExternalId}); links or creates that
     * debtor first, using {@code nameQuery} as the account's display name. No disambiguation step.
     */
    @Transactional
    public RecordOutcome recordForAccount(RecordCommand cmd, Long debtorExternalId) {
        LedgerService.validateAmount(cmd.amount());
        String displayName = DebtorResolver.requireName(cmd.nameQuery());
        User user = userService.getOrCreate(cmd.userExternalId(), cmd.userName(), cmd.userHandle());
        Debtor debtor = debtorService.getOrCreateByExternalId(user.getId(), debtorExternalId, displayName,
                                                              props.getMatch().getLinkThreshold());
        return append(user, debtor, cmd.amount(), cmd.kind(), cmd.note(), cmd.dueDate(), cmd.groupTag());
    }

    /** Empty when nothing is pending (or it expired) or the debtor is not the user's. */
    @Transactional
    public Optional<RecordOutcome> continueWithDebtor(Long userExternalId, String sessionToken, Long debtorId) {
        Optional<PendingDecision> pending = pendingDecisionService.take(userExternalId, sessionToken);
        if (pending.isEmpty()) return Optional.empty();
        Optional<User> user = userService.findByExternalId(userExternalId);
        if (user.isEmpty()) return Optional.empty();
        Optional<Debtor> debtor = debtorService.findOwned(user.get().getId(), debtorId);
        if (debtor.isEmpty()) return Optional.empty();
        return Optional.of(append(user.get(), debtor.get(), pending.get()));
    }

    /** Ignores the candidates and records against a debtor named exactly as typed. */
    @Transactional
    public Optional<RecordOutcome> continueWithNewDebtor(Long userExternalId, String sessionToken) {
        Optional<PendingDecision> pending = pendingDecisionService.take(userExternalId, sessionToken);
        if (pending.isEmpty()) return Optional.empty();
        Optional<User> user = userService.findByExternalId(userExternalId);
        if (user.isEmpty()) return Optional.empty();
        Debtor debtor = debtorService.getOrCreate(user.get().getId(), pending.get().getNameQuery());
        return Optional.of(append(user.get(), debtor, pending.get()));
    }

    private RecordOutcome append(User user, Debtor debtor, PendingDecision p) {
        return append(user, debtor, p.getAmount(), p.getKind(), p.getNote(), p.getDueDate(), p.getGroupTag());
    }

    private RecordOutcome append(User user, Debtor debtor, BigDecimal amount, TxKind kind,
                                 String note, Instant dueDate, Long groupTag) {
        Tx tx = ledgerService.append(debtor.getId(), amount, kind, note, dueDate, groupTag);
        return new RecordOutcome(debtor, tx, ledgerService.balance(debtor.getId()),
                                 ledgerService.allBalances(user.getId()), List.of());
    }

    public record RecordCommand(Long userExternalId,
                                String userName,
                                String userHandle,
                                String sessionToken,
                                String nameQuery,
                                BigDecimal amount,
                                TxKind kind,
                                String note,
                                Instant dueDate,
                                Long groupTag) {
    }

    /** Either a written entry with the new balances, or candidates to choose from. */
    public record RecordOutcome(Debtor debtor,
                                Tx transaction,
                                BigDecimal balance,
                                List<DebtorBalance> allBalances,
                                List<Candidate> candidates) {

        static RecordOutcome pending(List<Candidate> candidates) {
            return new RecordOutcome(null, null, null, List.of(), candidates);
        }

        public boolean isPending() {
            return transaction == null;
        }
    }
}
