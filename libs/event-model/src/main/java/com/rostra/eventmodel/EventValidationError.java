package com.rostra.eventmodel;

/**
 * A single violated invariant of a domain event or envelope.
 *
 * @param kind the category of violation
 * @param field the snake_case name of the offending field, as it appears on the wire
 * @param message human-readable description
 */
public record EventValidationError(Kind kind, String field, String message) {

    /** Categories of validation failure. */
    public enum Kind {
        /** A required string is null, empty or whitespace. */
        EMPTY_FIELD,
        /** A required identifier is null or the nil UUID. */
        NIL_UUID,
        /** A string exceeds its maximum length. */
        TOO_LONG,
        /** A numeric value is outside its allowed range. */
        OUT_OF_RANGE
    }

    @Override
    public String toString() {
        return kind + "(" + field + "): " + message;
    }
}
