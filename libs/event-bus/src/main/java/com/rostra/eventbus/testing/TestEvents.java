package com.rostra.eventbus.testing;

import com.rostra.eventmodel.DomainEvent;
import java.util.UUID;

/**
 * Ready-made valid events for tests.
 *
 * <p>Placed in {@code src/main/java} so other modules can use it in their test scope.
 */
public final class TestEvents {

    /** Default tenant used by tests that need only one. */
    public static final UUID TENANT = UUID.fromString("11111111-1111-1111-1111-111111111111");

    /** Default actor. */
    public static final UUID ACTOR = UUID.fromString("22222222-2222-2222-2222-222222222222");

    private TestEvents() {}

    public static DomainEvent.NodeCreated nodeCreated(UUID nodeId) {
        return new DomainEvent.NodeCreated(nodeId, "post", ACTOR);
    }

    public static DomainEvent.NodeCreated nodeCreated() {
        return nodeCreated(UUID.randomUUID());
    }

    public static DomainEvent.NodePublished nodePublished(UUID nodeId) {
        return new DomainEvent.NodePublished(nodeId, "post", ACTOR);
    }

    public static DomainEvent.ProductCreated productCreated(UUID productId) {
        return new DomainEvent.ProductCreated(productId, "SKU-001", "Test Product", 1000, "USD");
    }

    public static DomainEvent.OrderCreated orderCreated(UUID orderId) {
        return new DomainEvent.OrderCreated(orderId, UUID.randomUUID(), 2500, "USD");
    }

    public static DomainEvent.OrderPaid orderPaid(UUID orderId) {
        return new DomainEvent.OrderPaid(orderId, UUID.randomUUID(), 2500, "USD");
    }

    public static DomainEvent.TenantCreated tenantCreated(String slug) {
        return new DomainEvent.TenantCreated(slug);
    }
}
