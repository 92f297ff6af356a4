package com.rostra.eventmodel;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating a {@link DomainEvent} or {@link EventEnvelope}.
 *
 * @param valid true if validation passed with no errors
 * @param errors every violation found (empty when valid)
 */
public record ValidationResult(boolean valid, List<EventValidationError> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<EventValidationError> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** The first violation, if any. */
    public Optional<EventValidationError> firstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    /** Combines two results, keeping the errors of both. */
    public ValidationResult and(ValidationResult other) {
        if (valid && other.valid) {
            return this;
        }
        var combined = new java.util.ArrayList<EventValidationError>(errors);
        combined.addAll(other.errors);
        return fail(combined);
    }
}
