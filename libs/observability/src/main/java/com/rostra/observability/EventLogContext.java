package com.rostra.observability;

/**
 * Identifiers of the envelope currently being handled on a thread.
 *
 * <p>Set by the dispatcher around each handler invocation so that log lines written by handlers
 * carry the envelope and tenant they belong to.
 *
 * @param eventId envelope id
 * @param tenantId tenant that owns the event
 * @param actorId actor that caused the event, or null for system events
 * @param eventType dot-namespaced event type (e.g. "node.created")
 * @param handler name of the handler running, or null outside a handler
 */
public record EventLogContext(
        String eventId, String tenantId, String actorId, String eventType, String handler) {

    /** MDC key for the envelope id. */
    public static final String MDC_EVENT_ID = "eventId";

    /** MDC key for the tenant id. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the actor id. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for the event type. */
    public static final String MDC_EVENT_TYPE = "eventType";

    /** MDC key for the handler name. */
    public static final String MDC_HANDLER = "handler";

    public EventLogContext {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be null or blank");
        }
    }

    /** Returns a copy scoped to the given handler. */
    public EventLogContext withHandler(String handlerName) {
        return new EventLogContext(eventId, tenantId, actorId, eventType, handlerName);
    }
}
