package dev.univer.notoc.service;

import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.repo.TxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DeadlineService {
    private final TxRepository txRepository;
    private final Clock clock;

    /** {@code dueDate == null} clears the deadline. Empty when the entry is missing or not the user's. */
    @Transactional
    public Optional<Tx> setDueDate(Long userId, Long transactionId, Instant dueDate) {
        Optional<Tx> tx = txRepository.findOwned(userId, transactionId);
        tx.ifPresent(t -> {
            t.setDueDate(dueDate);
            log.info("Due date of tx {} set to {}", transactionId, dueDate);
        });
        return tx;
    }

    /**
     * Entries with a deadline, earliest first (then oldest first). With {@code withinDays}
     * only deadlines up to now + days are kept; overdue ones always pass that filter.
     */
    @Transactional(readOnly = true)
    public List<Tx> listUpcoming(Long userId, int limit, Integer withinDays) {
        if (limit <= 0) throw new ValidationException("Limit must be > 0");
        PageRequest page = PageRequest.of(0, limit);
        if (withinDays == null) return txRepository.findWithDueDate(userId, page);
        if (withinDays < 0) throw new ValidationException("Days must be >= 0");
        Instant until = clock.instant().plus(Duration.ofDays(withinDays));
        return txRepository.findWithDueDateUntil(userId, until, page);
    }
}
