package com.rostra.eventbus;

/** A handler failure that carries its own severity. */
public class EventHandlerException extends Exception {

    /** How loudly a handler failure is reported. */
    public enum Severity {
        WARNING,
        ERROR;

        /** Lower-case metric label. */
        public String label() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    private final Severity severity;

    public EventHandlerException(Severity severity, String message) {
        this(severity, message, null);
    }

    public EventHandlerException(Severity severity, String message, Throwable cause) {
        super(message, cause);
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
