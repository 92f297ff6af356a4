package com.rostra.eventbus;

import com.rostra.eventmodel.EventEnvelope;
import com.rostra.observability.EventMetrics;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A subscriber's bounded view of the {@link EventBus}.
 *
 * <p>Envelopes are buffered in publish order up to the bus capacity. When the buffer is full the
 * oldest envelope is discarded to make room; the publisher never waits. The number of discarded
 * envelopes is reported to the reader as a {@link SubscriptionLaggedException} on its next receive,
 * after which reading resumes with the oldest envelope still buffered.
 *
 * <p>A subscription has a single reader. Closing it detaches it from the bus; envelopes already
 * buffered can still be drained.
 */
public final class EventSubscription implements AutoCloseable {

    private final String name;
    private final int capacity;
    private final EventMetrics metrics;
    private final Consumer<EventSubscription> onClose;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final ArrayDeque<EventEnvelope> buffer;
    private long missed;
    private boolean closed;

    EventSubscription(String name, int capacity, EventMetrics metrics, Consumer<EventSubscription> onClose) {
        this.name = name;
        this.capacity = capacity;
        this.metrics = metrics;
        this.onClose = onClose;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    /** Envelopes currently buffered. */
    public int pending() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next envelope.
     *
     * @throws SubscriptionLaggedException if envelopes were dropped since the last receive
     * @throws SubscriptionClosedException if the subscription is closed and nothing is buffered
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public EventEnvelope receive() throws SubscriptionLaggedException, InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                reportLag();
                EventEnvelope next = buffer.pollFirst();
                if (next != null) {
                    return next;
                }
                if (closed) {
                    throw new SubscriptionClosedException(name);
                }
                available.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next envelope.
     *
     * @return the envelope, or empty on timeout or when the subscription is closed and drained
     * @throws SubscriptionLaggedException if envelopes were dropped since the last receive
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Optional<EventEnvelope> poll(Duration timeout)
            throws SubscriptionLaggedException, InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                reportLag();
                EventEnvelope next = buffer.pollFirst();
                if (next != null) {
                    return Optional.of(next);
                }
                if (closed || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = available.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Returns the next buffered envelope without waiting. */
    public Optional<EventEnvelope> tryReceive() throws SubscriptionLaggedException {
        lock.lock();
        try {
            reportLag();
            return Optional.ofNullable(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /** Detaches from the bus. Idempotent. */
    @Override
    public void close() {
        if (markClosed()) {
            onClose.accept(this);
        }
    }

    /** Called by the bus under its publish lock. */
    void offer(EventEnvelope envelope) {
        boolean droppedOne = false;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                missed++;
                droppedOne = true;
            }
            buffer.addLast(envelope);
            available.signal();
        } finally {
            lock.unlock();
        }
        if (droppedOne) {
            metrics.eventDropped(name, 1);
        }
    }

    /** Closes without notifying the bus; used when the bus itself shuts down. */
    boolean markClosed() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            available.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void reportLag() throws SubscriptionLaggedException {
        if (missed > 0) {
            long gap = missed;
            missed = 0;
            metrics.subscriberLagged(name, gap);
            throw new SubscriptionLaggedException(name, gap);
        }
    }
}
