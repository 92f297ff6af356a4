package com.rostra.eventbus;

import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventFactory;
import com.rostra.eventmodel.EventValidationError;
import com.rostra.eventmodel.EventValidator;
import com.rostra.eventmodel.ValidationResult;
import com.rostra.observability.EventMetrics;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process fan-out of validated domain events.
 *
 * <p>{@link #publish} validates the event, wraps it in an {@link EventEnvelope} and offers the same
 * envelope to every subscription that exists at that moment. Offers happen under a single lock, so
 * all subscribers observe envelopes in the same order. Publishing never blocks on a slow
 * subscriber: each subscription has its own bounded buffer that drops its oldest envelope on
 * overflow (see {@link EventSubscription}).
 *
 * <p>Delivery is best-effort and in memory only. Nothing is retained for subscriptions created
 * after a publish.
 */
public final class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-subscriber buffer size used when none is configured. */
    public static final int DEFAULT_CAPACITY = 128;

    private final int capacity;
    private final EventMetrics metrics;
    private final Clock clock;
    private final Object publishLock = new Object();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private volatile boolean closed;

    public EventBus() {
        this(DEFAULT_CAPACITY, EventMetrics.noop());
    }

    public EventBus(int capacity, EventMetrics metrics) {
        this(capacity, metrics, Clock.systemUTC());
    }

    /**
     * @param capacity per-subscriber buffer size, must be positive
     * @param metrics sink for publish, drop and subscriber metrics
     * @param clock source of envelope timestamps
     */
    public EventBus(int capacity, EventMetrics metrics, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.capacity = capacity;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validates and fans out an event.
     *
     * @param tenantId owning tenant, must not be null or nil
     * @param actorId originating user, or null for system events
     * @param event the fact to publish
     * @return the id of the new envelope
     * @throws InvalidEventException if the event or tenant id is invalid
     * @throws EventBusClosedException if the bus is closed
     */
    public UUID publish(UUID tenantId, UUID actorId, DomainEvent event) {
        ensureOpen();
        ValidationResult validation = validate(tenantId, event);
        if (!validation.valid()) {
            log.debug("Rejected event: {}", validation.errors());
            throw new InvalidEventException(validation.errors());
        }

        EventEnvelope envelope = EventFactory.create(tenantId, actorId, event, clock);
        int delivered;
        synchronized (publishLock) {
            ensureOpen();
            for (EventSubscription subscription : subscriptions) {
                subscription.offer(envelope);
            }
            delivered = subscriptions.size();
        }
        metrics.eventPublished(envelope.eventType().value());
        log.debug("Published {} {} for tenant {} to {} subscriber(s)",
                envelope.eventType().value(), envelope.id(), tenantId, delivered);
        return envelope.id();
    }

    /** Opens a subscription with a generated name. */
    public EventSubscription subscribe() {
        return subscribe("subscriber-" + sequence.incrementAndGet());
    }

    /**
     * Opens a subscription that receives every envelope published from now on.
     *
     * @param name label used in logs and metrics
     * @throws EventBusClosedException if the bus is closed
     */
    public EventSubscription subscribe(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        EventSubscription subscription = new EventSubscription(name, capacity, metrics, this::detach);
        synchronized (publishLock) {
            ensureOpen();
            subscriptions.add(subscription);
        }
        metrics.subscribersChanged(subscriptions.size());
        log.debug("Subscription '{}' opened", name);
        return subscription;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the bus and every open subscription. Readers drain what is already buffered and then
     * observe closure. Idempotent.
     */
    @Override
    public void close() {
        List<EventSubscription> open;
        synchronized (publishLock) {
            if (closed) {
                return;
            }
            closed = true;
            open = List.copyOf(subscriptions);
            subscriptions.clear();
        }
        open.forEach(EventSubscription::markClosed);
        metrics.subscribersChanged(0);
        log.info("Event bus closed, {} subscription(s) released", open.size());
    }

    private void detach(EventSubscription subscription) {
        synchronized (publishLock) {
            subscriptions.remove(subscription);
        }
        metrics.subscribersChanged(subscriptions.size());
        log.debug("Subscription '{}' closed", subscription.name());
    }

    private void ensureOpen() {
        if (closed) {
            throw new EventBusClosedException();
        }
    }

    private static ValidationResult validate(UUID tenantId, DomainEvent event) {
        ValidationResult envelopeFields = EventValidator.check()
                .notNilUuid("tenant_id", tenantId)
                .result();
        if (event == null) {
            return envelopeFields.and(ValidationResult.fail(List.of(new EventValidationError(
                    EventValidationError.Kind.EMPTY_FIELD, "event", "event must not be null"))));
        }
        return envelopeFields.and(event.validate());
    }
}
