package com.rostra.eventservice.projection;

import com.rostra.eventbus.EventHandler;
import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventservice.projection.EntityActivity.EntityKind;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the latest known state of every node, product and order.
 *
 * <p>Each entry is an upsert keyed by entity id and holds only fields taken from the event
 * payload, so delivering the same fact twice leaves the entry as it was after the first delivery.
 */
@Component
public class EntityActivityProjection implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(EntityActivityProjection.class);

    public static final String NAME = "entity-activity";

    private final Map<UUID, EntityActivity> activities = new ConcurrentHashMap<>();

    @Override
    public boolean matches(DomainEvent event) {
        return entityOf(event).isPresent();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(EventEnvelope envelope) {
        EntityRef ref = entityOf(envelope.event()).orElseThrow(
                () -> new IllegalArgumentException("No entity in " + envelope.eventType().value()));
        activities.put(ref.id(), new EntityActivity(
                ref.id(), ref.kind(), envelope.tenantId(), envelope.eventType(), ref.label()));
        log.debug("Recorded {} for {} {}", envelope.eventType().value(), ref.kind(), ref.id());
    }

    /** Returns the latest activity for an entity. */
    public Optional<EntityActivity> find(UUID entityId) {
        return Optional.ofNullable(activities.get(entityId));
    }

    /**
     * Returns the latest activity for an entity.
     *
     * @throws EntityNotFoundException if nothing was recorded for it
     */
    public EntityActivity get(UUID entityId) {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(entityId));
    }

    public int size() {
        return activities.size();
    }

    static Optional<EntityRef> entityOf(DomainEvent event) {
        if (event instanceof DomainEvent.NodeCreated e) {
            return Optional.of(new EntityRef(e.nodeId(), EntityKind.NODE, e.kind()));
        }
        if (event instanceof DomainEvent.NodeUpdated e) {
            return Optional.of(new EntityRef(e.nodeId(), EntityKind.NODE, e.kind()));
        }
        if (event instanceof DomainEvent.NodePublished e) {
            return Optional.of(new EntityRef(e.nodeId(), EntityKind.NODE, e.kind()));
        }
        if (event instanceof DomainEvent.NodeDeleted e) {
            return Optional.of(new EntityRef(e.nodeId(), EntityKind.NODE, e.kind()));
        }
        if (event instanceof DomainEvent.ProductCreated e) {
            return Optional.of(new EntityRef(e.productId(), EntityKind.PRODUCT, e.title()));
        }
        if (event instanceof DomainEvent.ProductUpdated e) {
            return Optional.of(new EntityRef(e.productId(), EntityKind.PRODUCT, e.title()));
        }
        if (event instanceof DomainEvent.OrderCreated e) {
            return Optional.of(new EntityRef(e.orderId(), EntityKind.ORDER, null));
        }
        if (event instanceof DomainEvent.OrderPaid e) {
            return Optional.of(new EntityRef(e.orderId(), EntityKind.ORDER, null));
        }
        return Optional.empty();
    }

    record EntityRef(UUID id, EntityKind kind, String label) {
    }
}
