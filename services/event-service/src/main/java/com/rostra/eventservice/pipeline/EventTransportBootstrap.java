package com.rostra.eventservice.pipeline;

import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventservice.config.EventBusProperties;
import com.rostra.eventtransport.StreamTransport;
import com.rostra.eventtransport.config.TransportConfig;
import com.rostra.observability.EventMetrics;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcome of bringing up the external transport at startup.
 *
 * <p>Either a ready {@link StreamTransport}, or local-only operation because the transport is
 * disabled or failed to start while {@code fail-on-error} is off. Closing the bootstrap closes the
 * transport, so a context that fails to refresh does not leak broker connections.
 */
public final class EventTransportBootstrap implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventTransportBootstrap.class);

    /** Startup outcome. */
    public enum Status {
        READY,
        DISABLED,
        FAILED
    }

    private final Status status;
    private final StreamTransport transport;
    private final String failure;

    private EventTransportBootstrap(Status status, StreamTransport transport, String failure) {
        this.status = status;
        this.transport = transport;
        this.failure = failure;
    }

    /**
     * Creates the transport described by {@code settings}.
     *
     * @throws IllegalStateException if the transport fails and {@code fail-on-error} is set
     */
    public static EventTransportBootstrap start(EventBusProperties.Transport settings, EventMetrics metrics) {
        if (!settings.enabled()) {
            log.warn("Event transport is not configured; event bus will operate in local in-memory mode");
            return new EventTransportBootstrap(Status.DISABLED, null, null);
        }
        try {
            TransportConfig config = settings.toTransportConfig();
            return new EventTransportBootstrap(Status.READY, StreamTransport.create(config, metrics), null);
        } catch (TransportException | IllegalArgumentException e) {
            if (settings.failOnError()) {
                throw new IllegalStateException("Event transport failed to start: " + e.getMessage(), e);
            }
            log.warn("Event transport failed to start ({}); event bus will operate in local in-memory mode",
                    e.getMessage());
            return new EventTransportBootstrap(Status.FAILED, null, e.getMessage());
        }
    }

    /** Wraps an already created transport. */
    public static EventTransportBootstrap of(StreamTransport transport) {
        return new EventTransportBootstrap(Status.READY, transport, null);
    }

    public Status status() {
        return status;
    }

    public Optional<StreamTransport> transport() {
        return Optional.ofNullable(transport);
    }

    /** Why the transport is not available, when it failed. */
    public Optional<String> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isLocalOnly() {
        return transport == null;
    }

    /** Closes the transport, if any. Idempotent. */
    @Override
    public void close() {
        if (transport != null) {
            transport.close();
        }
    }
}
