package com.rostra.eventbus;

import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventEnvelope;

/**
 * Reacts to domain events delivered by an {@link EventDispatcher}.
 *
 * <p>Handlers run on the dispatcher thread, one envelope at a time, in registration order. A
 * handler must tolerate seeing the same fact more than once and must not assume it sees every
 * fact: a lagging dispatcher skips envelopes. Any exception thrown from {@link #handle} is logged
 * and counted by the dispatcher, never propagated to the publisher or to other handlers.
 */
public interface EventHandler {

    /** Returns true if this handler wants the event. Must be cheap and side-effect free. */
    boolean matches(DomainEvent event);

    /** Stable name used in logs and metrics. */
    String name();

    /**
     * Processes one envelope.
     *
     * @throws EventHandlerException to report a failure with an explicit severity
     * @throws Exception any other failure, reported with {@link EventHandlerException.Severity#ERROR}
     */
    void handle(EventEnvelope envelope) throws Exception;

    /** Owning platform module, used as a metric label. */
    default String module() {
        return "core";
    }
}
