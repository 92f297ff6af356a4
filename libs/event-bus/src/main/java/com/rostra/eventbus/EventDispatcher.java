package com.rostra.eventbus;

import com.rostra.eventmodel.EventEnvelope;
import com.rostra.observability.EventLogContext;
import com.rostra.observability.EventLogContextHolder;
import com.rostra.observability.EventMetrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes envelopes from an {@link EventBus} to registered {@link EventHandler}s.
 *
 * <p>Handlers are registered while the dispatcher is {@link DispatcherState#CREATED}. {@link
 * #start()} subscribes to the bus and runs a single background loop that offers each envelope to
 * every matching handler in registration order. A failing handler is logged and counted and does
 * not affect the other handlers or the publisher.
 *
 * <pre>{@code
 * EventDispatcher dispatcher = new EventDispatcher(bus, metrics);
 * dispatcher.register(new NodeIndexHandler(index));
 * RunningDispatcher running = dispatcher.start();
 * ...
 * running.stop();
 * }</pre>
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    /** Name of the bus subscription owned by the dispatcher. */
    public static final String SUBSCRIPTION_NAME = "dispatcher";

    private final EventBus bus;
    private final EventMetrics metrics;
    private final DispatcherOptions options;
    private final List<EventHandler> handlers = new ArrayList<>();
    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.CREATED);
    private RunningDispatcher running;

    public EventDispatcher(EventBus bus, EventMetrics metrics) {
        this(bus, metrics, DispatcherOptions.defaults());
    }

    public EventDispatcher(EventBus bus, EventMetrics metrics, DispatcherOptions options) {
        if (bus == null) {
            throw new IllegalArgumentException("bus must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.bus = bus;
        this.metrics = metrics;
        this.options = options;
    }

    /**
     * Adds a handler.
     *
     * @throws IllegalStateException if the dispatcher has already been started
     */
    public synchronized EventDispatcher register(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (state.get() != DispatcherState.CREATED) {
            throw new IllegalStateException(
                    "handlers can only be registered before start, state is " + state.get());
        }
        handlers.add(handler);
        log.debug("Registered handler '{}' (module {})", handler.name(), handler.module());
        return this;
    }

    /**
     * Subscribes to the bus and starts the dispatch loop.
     *
     * @throws IllegalStateException unless the dispatcher is in {@link DispatcherState#CREATED}
     */
    public synchronized RunningDispatcher start() {
        if (!state.compareAndSet(DispatcherState.CREATED, DispatcherState.RUNNING)) {
            throw new IllegalStateException("dispatcher can only be started once, state is " + state.get());
        }
        EventSubscription subscription = bus.subscribe(SUBSCRIPTION_NAME);
        List<HandlerSlot> slots = handlers.stream().map(HandlerSlot::new).toList();
        RunningDispatcher handle = new RunningDispatcher(state, slots);
        running = handle;
        SubscriptionWorker worker = new SubscriptionWorker(
                "rostra-event-dispatcher",
                subscription,
                options.pollInterval(),
                envelope -> dispatch(slots, envelope, handle),
                () -> state.set(DispatcherState.STOPPED));
        handle.attach(worker);
        worker.start();
        log.info("Event dispatcher started with {} handler(s)", slots.size());
        return handle;
    }

    /** Stops the running loop, if any. Safe to call in any state. */
    public void stop() {
        RunningDispatcher current;
        synchronized (this) {
            current = running;
            if (current == null) {
                state.compareAndSet(DispatcherState.CREATED, DispatcherState.STOPPED);
                return;
            }
        }
        current.stop();
    }

    /** The handle returned by {@link #start()}, once started. */
    public synchronized Optional<RunningDispatcher> running() {
        return Optional.ofNullable(running);
    }

    public DispatcherState state() {
        return state.get();
    }

    public synchronized List<String> handlerNames() {
        return handlers.stream().map(EventHandler::name).toList();
    }

    private void dispatch(List<HandlerSlot> slots, EventEnvelope envelope, RunningDispatcher handle) {
        EventLogContext context = new EventLogContext(
                envelope.id().toString(),
                envelope.tenantId().toString(),
                envelope.actor().map(Object::toString).orElse(null),
                envelope.eventType().value(),
                null);
        for (HandlerSlot slot : slots) {
            if (slot.tripped) {
                continue;
            }
            EventLogContextHolder.runWithContext(
                    context.withHandler(slot.handler.name()), () -> invoke(slot, envelope));
        }
        handle.markProcessed();
    }

    private void invoke(HandlerSlot slot, EventEnvelope envelope) {
        EventHandler handler = slot.handler;
        long start = System.nanoTime();
        try {
            if (!handler.matches(envelope.event())) {
                return;
            }
            handler.handle(envelope);
            slot.consecutiveFailures = 0;
            metrics.handlerSucceeded(handler.name(), Duration.ofNanos(System.nanoTime() - start));
        } catch (EventHandlerException e) {
            onFailure(slot, envelope, e, e.severity());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            onFailure(slot, envelope, e, EventHandlerException.Severity.ERROR);
        }
    }

    private void onFailure(
            HandlerSlot slot, EventEnvelope envelope, Throwable error, EventHandlerException.Severity severity) {
        EventHandler handler = slot.handler;
        if (severity == EventHandlerException.Severity.WARNING) {
            log.warn("Handler '{}' failed on event {} ({}): {}",
                    handler.name(), envelope.id(), envelope.eventType().value(), error.getMessage());
        } else {
            log.error("Handler '{}' failed on event {} ({})",
                    handler.name(), envelope.id(), envelope.eventType().value(), error);
        }
        metrics.handlerError(handler.module(), handler.name(), error.getClass().getSimpleName(), severity.label());

        slot.consecutiveFailures++;
        if (options.circuitBreakerEnabled() && slot.consecutiveFailures >= options.maxConsecutiveFailures()) {
            slot.tripped = true;
            log.warn("Handler '{}' disabled after {} consecutive failures",
                    handler.name(), slot.consecutiveFailures);
        }
    }

    /** Per-handler bookkeeping, touched only by the dispatch thread except for reads. */
    static final class HandlerSlot {
        final EventHandler handler;
        volatile int consecutiveFailures;
        volatile boolean tripped;

        HandlerSlot(EventHandler handler) {
            this.handler = handler;
        }
    }
}
