package com.rostra.eventmodel;

import java.time.Clock;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 *
 * <p>Keeps id generation and timestamping in one place so every envelope is stamped the same way.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /** Creates an envelope with a random id, stamped with the current UTC time. */
    public static EventEnvelope create(UUID tenantId, UUID actorId, DomainEvent event) {
        return create(tenantId, actorId, event, Clock.systemUTC());
    }

    /** Creates an envelope stamped from the given clock. */
    public static EventEnvelope create(UUID tenantId, UUID actorId, DomainEvent event, Clock clock) {
        return new EventEnvelope(UUID.randomUUID(), tenantId, actorId, clock.instant(), event);
    }
}
