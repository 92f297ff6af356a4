package com.rostra.eventbus;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Handle on a started {@link EventDispatcher}. */
public final class RunningDispatcher {

    private final AtomicReference<DispatcherState> state;
    private final List<EventDispatcher.HandlerSlot> slots;
    private final AtomicLong processed = new AtomicLong();
    private SubscriptionWorker worker;

    RunningDispatcher(AtomicReference<DispatcherState> state, List<EventDispatcher.HandlerSlot> slots) {
        this.state = state;
        this.slots = slots;
    }

    void attach(SubscriptionWorker worker) {
        this.worker = worker;
    }

    void markProcessed() {
        processed.incrementAndGet();
    }

    /**
     * Stops the loop. Waits for the envelope in flight, if any; once this returns no handler is
     * invoked again. Idempotent.
     */
    public void stop() {
        worker.stop();
        state.set(DispatcherState.STOPPED);
    }

    public DispatcherState state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == DispatcherState.RUNNING;
    }

    /** Envelopes taken off the bus and offered to handlers so far. */
    public long processedCount() {
        return processed.get();
    }

    /** Handlers skipped after exceeding the consecutive failure threshold. */
    public List<String> trippedHandlers() {
        return slots.stream().filter(slot -> slot.tripped).map(slot -> slot.handler.name()).toList();
    }
}
