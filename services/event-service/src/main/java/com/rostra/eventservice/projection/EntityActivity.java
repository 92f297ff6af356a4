package com.rostra.eventservice.projection;

import com.rostra.eventmodel.EventType;
import java.util.UUID;

/**
 * Latest known state of one entity (node, product or order), built only from event payloads so a
 * redelivered fact leaves it unchanged.
 *
 * @param label node kind or product title; null for orders
 */
public record EntityActivity(
        UUID entityId,
        EntityKind kind,
        UUID tenantId,
        EventType lastEventType,
        String label) {

    public enum EntityKind {
        NODE,
        PRODUCT,
        ORDER
    }
}
