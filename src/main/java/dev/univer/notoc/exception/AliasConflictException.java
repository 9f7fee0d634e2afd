package dev.univer.notoc.exception;

import lombok.Getter;

/** The alias is already taken in the user's namespace, by another alias or by a debtor name. */
@Getter
public class AliasConflictException extends IllegalStateException {
    private final String alias;
    private final String takenBy;

    public AliasConflictException(String alias, String takenBy) {
        super("Alias \"" + alias + "\" is already used for \"" + takenBy + "\"");
        this.alias = alias;
        this.takenBy = takenBy;
    }
}
