package com.rostra.eventtransport.routing;

import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventType;
import java.util.UUID;

/**
 * Decides topic and partition key for an envelope.
 *
 * <p>{@code system.*} events go to {@link StreamTopic#SYSTEM}, everything else to {@link
 * StreamTopic#DOMAIN}. The partition key is always the tenant id in its canonical string form, so
 * one tenant's events stay ordered within a partition.
 */
public final class EventRouter {

    private EventRouter() {}

    public static Route route(EventEnvelope envelope) {
        return route(envelope.eventType(), envelope.tenantId());
    }

    public static Route route(EventType type, UUID tenantId) {
        StreamTopic topic = type.isSystem() ? StreamTopic.SYSTEM : StreamTopic.DOMAIN;
        return new Route(topic, tenantId.toString());
    }
}
