package com.rostra.eventbus;

import com.rostra.eventmodel.EventValidationError;
import java.util.List;
import java.util.stream.Collectors;

/** Thrown by {@link EventBus#publish} when an event fails validation; nothing is delivered. */
public class InvalidEventException extends IllegalArgumentException {

    private final List<EventValidationError> errors;

    public InvalidEventException(List<EventValidationError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    /** Every violation found, in check order. */
    public List<EventValidationError> errors() {
        return errors;
    }

    private static String describe(List<EventValidationError> errors) {
        return "invalid event: " + errors.stream()
                .map(EventValidationError::toString)
                .collect(Collectors.joining("; "));
    }
}
