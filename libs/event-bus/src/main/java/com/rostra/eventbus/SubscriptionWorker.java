package com.rostra.eventbus;

import com.rostra.eventmodel.EventEnvelope;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop that drains one subscription on a dedicated daemon thread.
 *
 * <p>Stopping is cooperative: the envelope being processed is finished, nothing is processed after
 * {@link #stop()} returns.
 */
final class SubscriptionWorker {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionWorker.class);

    private final EventSubscription subscription;
    private final Duration pollInterval;
    private final Consumer<EventEnvelope> processor;
    private final Runnable onExit;
    private final Thread thread;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile boolean stopping;

    SubscriptionWorker(
            String threadName,
            EventSubscription subscription,
            Duration pollInterval,
            Consumer<EventEnvelope> processor,
            Runnable onExit) {
        this.subscription = subscription;
        this.pollInterval = pollInterval;
        this.processor = processor;
        this.onExit = onExit;
        this.thread = new Thread(this::run, threadName);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    /** Requests the loop to end and waits for the in-flight envelope. Idempotent. */
    void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            awaitExit();
            return;
        }
        stopping = true;
        subscription.close();
        awaitExit();
    }

    private void awaitExit() {
        if (Thread.currentThread() == thread) {
            return;
        }
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void run() {
        log.debug("Worker for subscription '{}' started", subscription.name());
        try {
            while (!stopping) {
                Optional<EventEnvelope> next;
                try {
                    next = subscription.poll(pollInterval);
                } catch (SubscriptionLaggedException e) {
                    log.warn("Subscription '{}' lagged, {} event(s) skipped", e.subscriber(), e.missed());
                    continue;
                }
                if (stopping) {
                    break;
                }
                if (next.isPresent()) {
                    processor.accept(next.get());
                } else if (subscription.isClosed()) {
                    log.info("Subscription '{}' closed, worker exiting", subscription.name());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker for subscription '{}' interrupted", subscription.name());
        } finally {
            subscription.close();
            onExit.run();
            log.debug("Worker for subscription '{}' stopped", subscription.name());
        }
    }
}
