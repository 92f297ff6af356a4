package com.rostra.eventbus.transport;

import java.util.Optional;

/** Failure raised by an {@link EventTransport} while connecting, provisioning or publishing. */
public class TransportException extends Exception {

    /** Stage at which the transport failed. */
    public enum Kind {
        CONNECT,
        TOPOLOGY,
        PUBLISH
    }

    private final Kind kind;
    private final String topic;

    public TransportException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    /**
     * @param kind failing stage
     * @param topic logical topic involved, or null when not topic specific
     * @param message description
     * @param cause underlying client error, may be null
     */
    public TransportException(Kind kind, String topic, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
        this.topic = topic;
    }

    public Kind kind() {
        return kind;
    }

    public Optional<String> topic() {
        return Optional.ofNullable(topic);
    }
}
