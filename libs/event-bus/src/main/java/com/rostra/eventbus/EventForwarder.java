package com.rostra.eventbus;

import com.rostra.eventbus.transport.EventTransport;
import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.observability.EventLogContext;
import com.rostra.observability.EventLogContextHolder;
import com.rostra.observability.EventMetrics;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies every envelope published on an {@link EventBus} to an {@link EventTransport}.
 *
 * <p>Runs one subscription named {@value #SUBSCRIPTION_NAME} on its own thread. A failed publish is
 * logged with the event id and counted; the envelope is not retried and the forwarder moves on.
 * Envelopes dropped because the forwarder lagged are lost for the transport as well.
 */
public final class EventForwarder {

    private static final Logger log = LoggerFactory.getLogger(EventForwarder.class);

    public static final String SUBSCRIPTION_NAME = "forwarder";

    private final EventTransport transport;
    private final EventMetrics metrics;
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private SubscriptionWorker worker;

    private EventForwarder(EventTransport transport, EventMetrics metrics) {
        this.transport = transport;
        this.metrics = metrics;
    }

    /** Starts forwarding with the default poll interval. */
    public static EventForwarder start(EventBus bus, EventTransport transport, EventMetrics metrics) {
        return start(bus, transport, metrics, DispatcherOptions.DEFAULT_POLL_INTERVAL);
    }

    /**
     * Subscribes to {@code bus} and starts forwarding to {@code transport}.
     *
     * @param pollInterval how often the loop rechecks for stop while idle
     */
    public static EventForwarder start(
            EventBus bus, EventTransport transport, EventMetrics metrics, Duration pollInterval) {
        if (bus == null) {
            throw new IllegalArgumentException("bus must not be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        EventForwarder forwarder = new EventForwarder(transport, metrics);
        forwarder.worker = new SubscriptionWorker(
                "rostra-event-forwarder",
                bus.subscribe(SUBSCRIPTION_NAME),
                pollInterval,
                forwarder::forward,
                () -> log.info("Event forwarder stopped after {} forwarded, {} failed",
                        forwarder.forwarded.get(), forwarder.failed.get()));
        forwarder.worker.start();
        log.info("Event forwarder started ({} transport)", transport.reliabilityLevel());
        return forwarder;
    }

    /** Stops forwarding; waits for the envelope in flight. Idempotent. */
    public void stop() {
        worker.stop();
    }

    public boolean isRunning() {
        return worker.isAlive();
    }

    public long forwardedCount() {
        return forwarded.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public EventTransport transport() {
        return transport;
    }

    private void forward(EventEnvelope envelope) {
        EventLogContext context = new EventLogContext(
                envelope.id().toString(),
                envelope.tenantId().toString(),
                envelope.actor().map(Object::toString).orElse(null),
                envelope.eventType().value(),
                SUBSCRIPTION_NAME);
        EventLogContextHolder.runWithContext(context, () -> {
            try {
                transport.publish(envelope);
                forwarded.incrementAndGet();
            } catch (TransportException e) {
                failed.incrementAndGet();
                metrics.transportFailed(e.topic().orElse("unknown"), e.kind().name());
                log.error("Failed to forward event {} ({}) to transport: {}",
                        envelope.id(), envelope.eventType().value(), e.getMessage(), e);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                failed.incrementAndGet();
                metrics.transportFailed("unknown", e.getClass().getSimpleName());
                log.error("Unexpected error forwarding event {} ({})",
                        envelope.id(), envelope.eventType().value(), e);
            }
        });
    }
}
