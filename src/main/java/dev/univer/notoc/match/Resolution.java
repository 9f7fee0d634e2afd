package dev.univer.notoc.match;

import dev.univer.notoc.model.Debtor;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving a name. Either an exact match (alias or name) with no candidates,
 * a ranked candidate list that needs a human to choose, or nothing.
 */
public record Resolution(Debtor exactMatch, List<Candidate> candidates, MatchKind kind) {

    public Resolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static Resolution exact(Debtor debtor, MatchKind kind) {
        return new Resolution(debtor, List.of(), kind);
    }

    public static Resolution fuzzy(List<Candidate> candidates) {
        return new Resolution(null, candidates, MatchKind.FUZZY);
    }

    public static Resolution none() {
        return new Resolution(null, List.of(), MatchKind.NONE);
    }

    public Optional<Debtor> exact() {
        return Optional.ofNullable(exactMatch);
    }

    public boolean isAmbiguous() {
        return kind == MatchKind.FUZZY;
    }
}
