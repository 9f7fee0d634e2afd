package dev.univer.notoc.service;

import dev.univer.notoc.config.NotocProperties;
import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.match.Candidate;
import dev.univer.notoc.match.CandidateRanker;
import dev.univer.notoc.match.MatchKind;
import dev.univer.notoc.match.Resolution;
import dev.univer.notoc.model.Alias;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.repo.AliasRepository;
import dev.univer.notoc.repo.DebtorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Turns a free-form name into a debtor of the given user.
 * <p>
 * Steps, first hit wins:
 * <ol>
 *     <li>alias equal to the query (case-insensitive),</li>
 *     <li>debtor name equal to the query (case-insensitive),</li>
 *     <li>fuzzy candidates over names and aliases.</li>
 * </ol>
 * A fuzzy result is never collapsed to its top entry; the caller has to ask the user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtorResolver {
    private final AliasRepository aliasRepository;
    private final DebtorRepository debtorRepository;
    private final CandidateRanker ranker;
    private final NotocProperties props;

    @Transactional(readOnly = true)
    public Resolution resolve(Long userId, String nameQuery) {
        return resolve(userId, nameQuery, props.getMatch().getThreshold());
    }

    @Transactional(readOnly = true)
    public Resolution resolve(Long userId, String nameQuery, int threshold) {
        String query = requireName(nameQuery);

        List<Alias> aliases = aliasRepository.findAllByUserAndNameIgnoreCase(userId, query);
        if (!aliases.isEmpty()) {
            log.debug("'{}' resolved by alias for user {}", query, userId);
            return Resolution.exact(aliases.get(0).getDebtor(), MatchKind.ALIAS);
        }

        List<Debtor> byName = debtorRepository.findAllByUserAndNameIgnoreCase(userId, query);
        if (!byName.isEmpty()) {
            log.debug("'{}' resolved by name for user {}", query, userId);
            return Resolution.exact(byName.get(0), MatchKind.NAME);
        }

        List<Candidate> candidates = ranker.rank(userId, query, threshold);
        log.debug("'{}' for user {}: {} fuzzy candidates", query, userId, candidates.size());
        return candidates.isEmpty() ? Resolution.none() : Resolution.fuzzy(candidates);
    }

    /**
     * Name-only variant for flows that do not care about aliases: plain fuzzy search,
     * where a top score of 100 counts as the exact match.
     */
    @Transactional(readOnly = true)
    public Resolution resolveByName(Long userId, String nameQuery, int threshold) {
        String query = requireName(nameQuery);
        List<Candidate> candidates = ranker.rankByName(userId, query, threshold);
        if (candidates.isEmpty()) return Resolution.none();
        Candidate top = candidates.get(0);
        if (top.isExact()) return Resolution.exact(top.debtor(), MatchKind.NAME);
        return Resolution.fuzzy(candidates);
    }

    static String requireName(String name) {
        if (name == null || name.isBlank()) throw new ValidationException("Name must not be empty");
        return name.strip();
    }
}
