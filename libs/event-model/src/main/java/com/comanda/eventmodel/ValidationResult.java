package com.comanda.eventmodel;

import java.util.List;

/**
 * Every problem found in one event, so a rejected append can report them all at once.
 *
 * @param errors human-readable problems, empty when the event is valid
 */
public record ValidationResult(List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? OK : new ValidationResult(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /** The same errors, each prefixed, e.g. with the position of the event in a batch. */
    public ValidationResult prefixed(String prefix) {
        return new ValidationResult(errors.stream().map(error -> prefix + error).toList());
    }

    /** Errors joined into one line, for exception messages. */
    public String summary() {
        return String.join("; ", errors);
    }
}
