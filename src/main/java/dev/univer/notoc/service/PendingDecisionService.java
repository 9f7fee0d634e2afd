package dev.univer.notoc.service;

import dev.univer.notoc.config.NotocProperties;
import dev.univer.notoc.model.PendingDecision;
import dev.univer.notoc.repo.PendingDecisionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Pending "which debtor did you mean" records, one per (user, session).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingDecisionService {
    private final PendingDecisionRepository repository;
    private final NotocProperties props;
    private final Clock clock;

    /** Replaces whatever was pending for the same user and session. */
    @Transactional
    public PendingDecision save(PendingDecision decision) {
        repository.deleteByKey(decision.getUserExternalId(), decision.getSessionToken());
        decision.setId(null);
        decision.setExpiresAt(clock.instant().plus(props.getPending().getTtl()));
        return repository.save(decision);
    }

    /** Consumes the decision. Expired decisions are removed too, but reported as absent. */
    @Transactional
    public Optional<PendingDecision> take(Long userExternalId, String sessionToken) {
        Optional<PendingDecision> found = repository.findByUserExternalIdAndSessionToken(userExternalId, sessionToken);
        if (found.isEmpty()) return Optional.empty();
        PendingDecision d = found.get();
        repository.delete(d);
        if (!d.getExpiresAt().isAfter(clock.instant())) {
            log.debug("Pending decision of user {} in session {} expired", userExternalId, sessionToken);
            return Optional.empty();
        }
        return Optional.of(d);
    }

    @Transactional
    public int purgeExpired() {
        return repository.deleteExpired(clock.instant());
    }
}
