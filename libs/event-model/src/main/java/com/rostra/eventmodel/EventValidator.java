package com.rostra.eventmodel;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Field-level checks shared by all {@link DomainEvent} variants, plus envelope validation.
 *
 * <p>Checks accumulate into a {@link Checks} collector so a caller sees every violation at once
 * rather than only the first one.
 */
public final class EventValidator {

    /** The nil UUID ({@code 00000000-0000-0000-0000-000000000000}). */
    public static final UUID NIL_UUID = new UUID(0L, 0L);

    private EventValidator() {
        // utility class
    }

    /** Starts a new check chain. */
    public static Checks check() {
        return new Checks();
    }

    /**
     * Validates the domain event carried by an envelope together with the envelope's own
     * identity fields.
     */
    public static ValidationResult validate(EventEnvelope envelope) {
        if (envelope == null) {
            return ValidationResult.fail(List.of(new EventValidationError(
                    EventValidationError.Kind.EMPTY_FIELD, "envelope", "envelope must not be null")));
        }
        ValidationResult own = check()
                .notNilUuid("id", envelope.id())
                .notNilUuid("tenant_id", envelope.tenantId())
                .notNull("occurred_at", envelope.occurredAt())
                .notNull("event", envelope.event())
                .result();
        return envelope.event() == null ? own : own.and(envelope.event().validate());
    }

    /** True for null or the nil UUID. */
    public static boolean isNil(UUID id) {
        return id == null || NIL_UUID.equals(id);
    }

    /** Fluent collector of validation errors. */
    public static final class Checks {

        private final List<EventValidationError> errors = new ArrayList<>();

        private Checks() {}

        public Checks notNull(String field, Object value) {
            if (value == null) {
                add(EventValidationError.Kind.EMPTY_FIELD, field, field + " must not be null");
            }
            return this;
        }

        public Checks notEmpty(String field, String value) {
            if (value == null || value.isBlank()) {
                add(EventValidationError.Kind.EMPTY_FIELD, field, field + " must not be empty");
            }
            return this;
        }

        public Checks maxLength(String field, String value, int max) {
            if (value != null && value.length() > max) {
                add(EventValidationError.Kind.TOO_LONG, field,
                        field + " must be at most " + max + " characters, was " + value.length());
            }
            return this;
        }

        public Checks notNilUuid(String field, UUID value) {
            if (isNil(value)) {
                add(EventValidationError.Kind.NIL_UUID, field, field + " must not be nil");
            }
            return this;
        }

        public Checks nonNegative(String field, long value) {
            return range(field, value, 0, Long.MAX_VALUE);
        }

        public Checks range(String field, long value, long min, long max) {
            if (value < min || value > max) {
                add(EventValidationError.Kind.OUT_OF_RANGE, field,
                        field + " must be within [" + min + ", " + max + "], was " + value);
            }
            return this;
        }

        public ValidationResult result() {
            return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
        }

        private void add(EventValidationError.Kind kind, String field, String message) {
            errors.add(new EventValidationError(kind, field, message));
        }
    }
}
