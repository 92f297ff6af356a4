package com.rostra.eventservice.projection;

import java.util.UUID;

/** No activity has been recorded for the requested entity. */
public class EntityNotFoundException extends RuntimeException {

    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("No activity recorded for entity " + entityId);
        this.entityId = entityId;
    }

    public UUID entityId() {
        return entityId;
    }
}
