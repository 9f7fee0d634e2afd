package dev.univer.notoc.exception;

/** Malformed input: non-positive amount, blank name and the like. Nothing is written. */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }
}
