package com.rostra.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link EventLogContext} with an SLF4J MDC bridge.
 *
 * <p>While a context is set, the MDC keys {@code eventId}, {@code tenantId}, {@code actorId},
 * {@code eventType} and {@code handler} are populated on the current thread. Clearing removes exactly those keys, so an
 * MDC populated by the HTTP layer (e.g. {@code correlationId}) is left alone.
 */
public final class EventLogContextHolder {

    private static final ThreadLocal<EventLogContext> CONTEXT = new ThreadLocal<>();

    private EventLogContextHolder() {}

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(EventLogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(EventLogContext.MDC_EVENT_ID, context.eventId());
        setMdc(EventLogContext.MDC_TENANT_ID, context.tenantId());
        setMdc(EventLogContext.MDC_ACTOR_ID, context.actorId());
        setMdc(EventLogContext.MDC_EVENT_TYPE, context.eventType());
        setMdc(EventLogContext.MDC_HANDLER, context.handler());
    }

    public static Optional<EventLogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(EventLogContext.MDC_EVENT_ID);
        MDC.remove(EventLogContext.MDC_TENANT_ID);
        MDC.remove(EventLogContext.MDC_ACTOR_ID);
        MDC.remove(EventLogContext.MDC_EVENT_TYPE);
        MDC.remove(EventLogContext.MDC_HANDLER);
    }

    /**
     * Runs {@code work} with the given context set, then restores whatever context was there
     * before (or clears it).
     */
    public static void runWithContext(EventLogContext context, Runnable work) {
        EventLogContext previous = CONTEXT.get();
        try {
            set(context);
            work.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
