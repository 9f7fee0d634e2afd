package dev.univer.notoc.service;

import dev.univer.notoc.exception.AliasConflictException;
import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.match.Candidate;
import dev.univer.notoc.match.CandidateRanker;
import dev.univer.notoc.match.Resolution;
import dev.univer.notoc.model.Alias;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.model.User;
import dev.univer.notoc.repo.AliasRepository;
import dev.univer.notoc.repo.DebtorRepository;
import dev.univer.notoc.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DebtorService {
    private final UserRepository userRepository;
    private final UserService userService;
    private final DebtorRepository debtorRepository;
    private final AliasRepository aliasRepository;
    private final DebtorResolver resolver;
    private final CandidateRanker ranker;
    private final Clock clock;

    /**
     * Exact (case-insensitive) name lookup or creation. The owner row is locked first,
     * so two concurrent calls for the same name end up with one debtor.
     */
    @Transactional
    public Debtor getOrCreate(Long userId, String name) {
        String n = DebtorResolver.requireName(name);
        User owner = lockOwner(userId);
        List<Debtor> existing = debtorRepository.findAllByUserAndNameIgnoreCase(userId, n);
        if (!existing.isEmpty()) return existing.get(0);
        return create(owner, n, null);
    }

    /**
     * Alias or exact name, otherwise a new debtor named after the query.
     * Fuzzy candidates are not used here: picking one would need a confirmation.
     */
    @Transactional
    public Debtor resolveOrCreate(Long userId, String nameQuery) {
        Resolution r = resolver.resolve(userId, nameQuery);
        return r.exact().orElseGet(() -> getOrCreate(userId, nameQuery));
    }

    /**
     * For mentions of a real telegram account:
     * 1) debtor already linked to that account (its name follows the account's name),
     * 2) best name-only fuzzy match that is not linked yet gets linked,
     * 3) a new linked debtor.
     */
    @Transactional
    public Debtor getOrCreateByExternalId(Long userId, Long externalId, String displayName, int threshold) {
        String n = DebtorResolver.requireName(displayName);
        User owner = lockOwner(userId);

        Optional<Debtor> linked = debtorRepository.findFirstByUser_IdAndExternalIdOrderByIdAsc(userId, externalId);
        if (linked.isPresent()) {
            Debtor d = linked.get();
            if (!d.getName().equals(n)) d.setName(n);
            return d;
        }

        List<Candidate> candidates = ranker.rankByName(userId, n, threshold);
        if (!candidates.isEmpty() && candidates.get(0).debtor().getExternalId() == null) {
            Debtor d = candidates.get(0).debtor();
            d.setExternalId(externalId);
            log.info("Linked debtor {} to external id {} by name '{}'", d.getId(), externalId, n);
            return d;
        }
        return create(owner, n, externalId);
    }

    /**
     * Adds a nickname for the debtor called {@code realName}. Runs under the owner lock, like debtor
     * creation, so two concurrent requests cannot both pass the collision check.
     *
     * @return the debtor, or empty if the user has no debtor with that name
     * @throws AliasConflictException if the alias is taken by an alias or a debtor name of this user
     */
    @Transactional
    public Optional<Debtor> addAlias(Long userId, String alias, String realName) {
        String a = DebtorResolver.requireName(alias);
        String real = DebtorResolver.requireName(realName);
        lockOwner(userId);

        List<Debtor> targets = debtorRepository.findAllByUserAndNameIgnoreCase(userId, real);
        if (targets.isEmpty()) return Optional.empty();
        Debtor debtor = targets.get(0);

        List<Alias> taken = aliasRepository.findAllByUserAndNameIgnoreCase(userId, a);
        if (!taken.isEmpty()) {
            throw new AliasConflictException(a, taken.get(0).getDebtor().getName());
        }
        List<Debtor> sameName = debtorRepository.findAllByUserAndNameIgnoreCase(userId, a);
        if (!sameName.isEmpty()) {
            throw new AliasConflictException(a, sameName.get(0).getName());
        }

        aliasRepository.save(Alias.builder().debtor(debtor).name(a).build());
        log.info("Alias '{}' added to debtor {} of user {}", a, debtor.getId(), userId);
        return Optional.of(debtor);
    }

    @Transactional(readOnly = true)
    public List<Alias> aliases(Long userId, Long debtorId) {
        if (debtorRepository.findByIdAndUser_Id(debtorId, userId).isEmpty()) return List.of();
        return aliasRepository.findAllByDebtor_IdOrderByIdAsc(debtorId);
    }

    /** Stores the telegram id of the user behind {@code handle} on the debtor, enabling notifications. */
    @Transactional
    public LinkResult link(Long userId, String debtorName, String handle) {
        Optional<User> target = userService.findByHandle(handle);
        if (target.isEmpty()) return new LinkResult(LinkResult.Status.UNKNOWN_HANDLE, null);

        Optional<Debtor> debtor = resolver.resolve(userId, debtorName).exact();
        if (debtor.isEmpty()) return new LinkResult(LinkResult.Status.UNKNOWN_DEBTOR, null);

        Debtor d = debtor.get();
        d.setExternalId(target.get().getExternalId());
        log.info("Debtor {} of user {} linked to external id {}", d.getId(), userId, d.getExternalId());
        return new LinkResult(LinkResult.Status.LINKED, d);
    }

    @Transactional(readOnly = true)
    public Optional<Debtor> findOwned(Long userId, Long debtorId) {
        return debtorRepository.findByIdAndUser_Id(debtorId, userId);
    }

    @Transactional(readOnly = true)
    public List<Debtor> list(Long userId) {
        return debtorRepository.findAllByUser_IdOrderByIdAsc(userId);
    }

    private User lockOwner(Long userId) {
        return userRepository.findByIdForUpdate(userId)
                             .orElseThrow(() -> new ValidationException("Unknown user: " + userId));
    }

    private Debtor create(User owner, String name, Long externalId) {
        Debtor d = debtorRepository.save(Debtor.builder()
                                               .user(owner)
                                               .name(name)
                                               .externalId(externalId)
                                               .createdAt(clock.instant())
                                               .build());
        log.info("Created debtor {} '{}' for user {}", d.getId(), name, owner.getId());
        return d;
    }

    public record LinkResult(Status status, Debtor debtor) {
        public enum Status { LINKED, UNKNOWN_HANDLE, UNKNOWN_DEBTOR }
    }
}
