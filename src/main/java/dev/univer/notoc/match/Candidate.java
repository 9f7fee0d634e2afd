package dev.univer.notoc.match;

import dev.univer.notoc.model.Debtor;

public record Candidate(Debtor debtor, int score) {
    public boolean isExact() {
        return score == 100;
    }
}
