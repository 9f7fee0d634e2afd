package dev.univer.notoc.match;

/** Which resolution step produced the result. */
public enum MatchKind {
    ALIAS, NAME, FUZZY, NONE
}
