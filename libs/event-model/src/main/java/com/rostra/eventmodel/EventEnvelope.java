package com.rostra.eventmodel;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Transport-ready wrapper around a validated {@link DomainEvent}.
 *
 * <p>An envelope is created exactly once, when the event is published, and is never modified
 * afterwards. Every subscriber receives the same instance; since the record and the event it wraps
 * are immutable, sharing it is safe across threads.
 *
 * @param id unique identifier of this event instance
 * @param tenantId owning tenant; scopes the event and is the transport partition key
 * @param actorId user that caused the event, or {@code null} for system-originated facts
 * @param occurredAt creation timestamp (UTC)
 * @param event the domain fact
 */
public record EventEnvelope(UUID id, UUID tenantId, UUID actorId, Instant occurredAt, DomainEvent event) {

    /** Shortcut for {@code event().eventType()}. */
    public EventType eventType() {
        return event.eventType();
    }

    /** The originating user, when there is one. */
    public Optional<UUID> actor() {
        return Optional.ofNullable(actorId);
    }
}
