package dev.univer.notoc.match;

import dev.univer.notoc.model.Alias;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.repo.AliasRepository;
import dev.univer.notoc.repo.DebtorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Scores every debtor of a user against a query and keeps those at or above the threshold.
 * Each debtor appears at most once, at the best score over its name and aliases.
 * Equal scores keep debtor creation order (ascending id).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateRanker {

    private final DebtorRepository debtorRepository;
    private final AliasRepository aliasRepository;
    private final SimilarityScorer scorer;

    /** Scores names and aliases. */
    @Transactional(readOnly = true)
    public List<Candidate> rank(Long userId, String query, int threshold) {
        List<Debtor> debtors = debtorRepository.findAllByUser_IdOrderByIdAsc(userId);
        Map<Long, List<String>> aliases = aliasRepository.findAllByUser(userId).stream()
                .collect(Collectors.groupingBy(a -> a.getDebtor().getId(),
                                               Collectors.mapping(Alias::getName, Collectors.toList())));
        return rank(debtors, aliases, query, threshold);
    }

    /** Scores debtor names only. */
    @Transactional(readOnly = true)
    public List<Candidate> rankByName(Long userId, String query, int threshold) {
        return rank(debtorRepository.findAllByUser_IdOrderByIdAsc(userId), Map.of(), query, threshold);
    }

    List<Candidate> rank(List<Debtor> debtors, Map<Long, List<String>> aliasesByDebtor, String query, int threshold) {
        String q = normalize(query);
        if (q.isEmpty()) return List.of();

        Map<Long, Candidate> byDebtor = new LinkedHashMap<>();
        for (Debtor d : debtors) {
            int best = scorer.score(q, normalize(d.getName()));
            for (String alias : aliasesByDebtor.getOrDefault(d.getId(), List.of())) {
                if (best == 100) break;
                best = Math.max(best, scorer.score(q, normalize(alias)));
            }
            if (best >= threshold) {
                byDebtor.merge(d.getId(), new Candidate(d, best),
                               (a, b) -> a.score() >= b.score() ? a : b);
            }
        }

        List<Candidate> out = new ArrayList<>(byDebtor.values());
        out.sort(Comparator.comparingInt(Candidate::score).reversed());
        log.debug("Ranked '{}' against {} debtors, {} at or above {}", q, debtors.size(), out.size(), threshold);
        return out;
    }

    static String normalize(String s) {
        return s == null ? "" : s.strip().toLowerCase(Locale.ROOT);
    }
}
