package com.rostra.eventtransport;

import com.rostra.eventbus.transport.EventTransport;
import com.rostra.eventbus.transport.ReliabilityLevel;
import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventSerializer;
import com.rostra.eventtransport.backend.EmbeddedBackend;
import com.rostra.eventtransport.backend.RemoteBackend;
import com.rostra.eventtransport.backend.StreamBackend;
import com.rostra.eventtransport.config.TransportConfig;
import com.rostra.eventtransport.config.TransportMode;
import com.rostra.eventtransport.routing.EventRouter;
import com.rostra.eventtransport.routing.Route;
import com.rostra.eventtransport.routing.StreamTopology;
import com.rostra.observability.EventMetrics;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventTransport} that appends envelopes to a partitioned stream.
 *
 * <p>Construction connects the backend and provisions the topology; if either step fails the
 * backend is shut down and the failure is rethrown, so an instance always refers to a ready
 * stream. Envelopes are routed by {@link EventRouter}, serialized with {@link EventSerializer} and
 * appended with the tenant id as key.
 */
public final class StreamTransport implements EventTransport {

    private static final Logger log = LoggerFactory.getLogger(StreamTransport.class);

    private final TransportConfig config;
    private final StreamBackend backend;
    private final StreamTopology topology;
    private final EventMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    private StreamTransport(
            TransportConfig config, StreamBackend backend, StreamTopology topology, EventMetrics metrics) {
        this.config = config;
        this.backend = backend;
        this.topology = topology;
        this.metrics = metrics;
    }

    /**
     * Builds the backend selected by {@code config.mode()} and brings it up.
     *
     * @throws TransportException of kind CONNECT or TOPOLOGY
     */
    public static StreamTransport create(TransportConfig config, EventMetrics metrics) throws TransportException {
        return create(config, backendFor(config), metrics);
    }

    /**
     * Brings up the given backend: connect, then ensure topology.
     *
     * @throws TransportException of kind CONNECT or TOPOLOGY
     */
    public static StreamTransport create(TransportConfig config, StreamBackend backend, EventMetrics metrics)
            throws TransportException {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        StreamTopology topology = StreamTopology.from(config);
        try {
            backend.connect();
            topology.ensure(backend);
        } catch (TransportException | RuntimeException e) {
            log.error("Stream transport '{}' failed to start on {} backend", config.stream(), backend.name(), e);
            backend.shutdown();
            throw e;
        }
        log.info("Stream transport ready: stream '{}', {} backend, {} domain partition(s)",
                config.stream(), backend.name(), topology.domainPartitions());
        return new StreamTransport(config, backend, topology, metrics);
    }

    static StreamBackend backendFor(TransportConfig config) {
        return config.mode() == TransportMode.REMOTE
                ? new RemoteBackend(config.remote())
                : new EmbeddedBackend(config.embedded());
    }

    @Override
    public void publish(EventEnvelope envelope) throws TransportException {
        Route route = EventRouter.route(envelope);
        String topic = route.topic().value();
        if (closed.get()) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic, "transport is closed", null);
        }
        String payload;
        try {
            payload = EventSerializer.serialize(envelope);
        } catch (EventSerializer.EventSerializationException e) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic,
                    "cannot serialize event " + envelope.id(), e);
        }
        long start = System.nanoTime();
        try {
            backend.append(route.topic().physicalName(config.stream()), route.key(), payload);
        } catch (TransportException e) {
            throw new TransportException(e.kind(), topic, e.getMessage(), e.getCause());
        }
        metrics.transportPublished(topic, Duration.ofNanos(System.nanoTime() - start));
        log.debug("Appended event {} to {} with key {}", envelope.id(), topic, route.key());
    }

    @Override
    public ReliabilityLevel reliabilityLevel() {
        return ReliabilityLevel.STREAMING;
    }

    public TransportMode mode() {
        return config.mode();
    }

    public String stream() {
        return config.stream();
    }

    public StreamTopology topology() {
        return topology;
    }

    public StreamBackend backend() {
        return backend;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Shuts the backend down. Idempotent. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            backend.shutdown();
            log.info("Stream transport '{}' closed", config.stream());
        }
    }
}
