package dev.univer.notoc.service;

import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.model.TxKind;
import dev.univer.notoc.repo.AliasRepository;
import dev.univer.notoc.repo.DebtorBalance;
import dev.univer.notoc.repo.DebtorRepository;
import dev.univer.notoc.repo.TxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only ledger. Balances are never stored: they are summed from the entries on every read,
 * DEBT counting positive and CREDIT negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {
    private final TxRepository txRepository;
    private final DebtorRepository debtorRepository;
    private final AliasRepository aliasRepository;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Transactional
    public Tx append(Long debtorId, BigDecimal amount, TxKind kind, String note, Instant dueDate, Long groupTag) {
        validateAmount(amount);
        if (kind == null) throw new ValidationException("Transaction kind is required");
        Debtor debtor = debtorRepository.findById(debtorId)
                                        .orElseThrow(() -> new ValidationException("Unknown debtor: " + debtorId));

        Tx tx = txRepository.save(Tx.builder()
                                    .debtor(debtor)
                                    .amount(amount)
                                    .kind(kind)
                                    .note(blankToNull(note))
                                    .dueDate(dueDate)
                                    .groupTag(groupTag)
                                    .createdAt(clock.instant())
                                    .build());
        log.info("Recorded {} {} for debtor {} (tx {})", kind, amount.toPlainString(), debtorId, tx.getId());

        if (debtor.getExternalId() != null) {
            publisher.publishEvent(new TxRecordedEvent(tx.getId(), debtor.getExternalId(),
                                                       debtor.getUser().getDisplayName(),
                                                       amount, kind, tx.getNote()));
        }
        return tx;
    }

    @Transactional(readOnly = true)
    public BigDecimal balance(Long debtorId) {
        BigDecimal sum = txRepository.sumSignedByDebtor(debtorId);
        return sum == null ? BigDecimal.ZERO : sum;
    }

    /** Debtors with a non-zero balance, most owed to the user first. One grouped query. */
    @Transactional(readOnly = true)
    public List<DebtorBalance> allBalances(Long userId) {
        return txRepository.nonZeroBalancesByUser(userId);
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<Tx> history(Long debtorId, int limit) {
        return txRepository.findAllByDebtor_IdOrderByCreatedAtDescIdDesc(debtorId, page(limit));
    }

    /** All of the user's entries, or one debtor's when {@code debtorId} is given; newest first. */
    @Transactional(readOnly = true)
    public List<Tx> historyForUser(Long userId, Long debtorId, int limit) {
        return debtorId == null
               ? txRepository.findRecentByUser(userId, page(limit))
               : txRepository.findRecentByUserAndDebtor(userId, debtorId, page(limit));
    }

    @Transactional(readOnly = true)
    public Optional<Tx> findOwned(Long userId, Long transactionId) {
        return txRepository.findOwned(userId, transactionId);
    }

    /** False when the entry is missing or belongs to someone else; the two are not distinguished. */
    @Transactional
    public boolean deleteTransaction(Long userId, Long transactionId) {
        Optional<Tx> tx = txRepository.findOwned(userId, transactionId);
        if (tx.isEmpty()) return false;
        txRepository.delete(tx.get());
        log.info("Deleted tx {} of user {}", transactionId, userId);
        return true;
    }

    /** Removes the debtor with its aliases and entries. */
    @Transactional
    public boolean deleteDebtor(Long userId, Long debtorId) {
        if (debtorRepository.findByIdAndUser_Id(debtorId, userId).isEmpty()) return false;
        purge(List.of(debtorId));
        log.info("Deleted debtor {} of user {}", debtorId, userId);
        return true;
    }

    /** @return number of debtors removed */
    @Transactional
    public int deleteAll(Long userId) {
        List<Long> ids = debtorRepository.findIdsByUser(userId);
        if (ids.isEmpty()) return 0;
        int removed = purge(ids);
        log.info("Deleted all {} debtors of user {}", removed, userId);
        return removed;
    }

    @Transactional(readOnly = true)
    public long countDebtors(Long userId) {
        return debtorRepository.countByUser_Id(userId);
    }

    private int purge(List<Long> debtorIds) {
        txRepository.deleteAllByDebtorIds(debtorIds);
        aliasRepository.deleteAllByDebtorIds(debtorIds);
        return debtorRepository.deleteAllByIds(debtorIds);
    }

    static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be > 0");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("Amount has more than two decimal places: " + amount.toPlainString());
        }
    }

    private static PageRequest page(int limit) {
        if (limit <= 0) throw new ValidationException("Limit must be > 0");
        return PageRequest.of(0, limit);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
