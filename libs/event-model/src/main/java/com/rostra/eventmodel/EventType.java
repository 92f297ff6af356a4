package com.rostra.eventmodel;

import java.util.Optional;

/**
 * All known domain event types in the Rostra platform.
 *
 * <p>The {@code value} is the stable, dot-namespaced string used for routing and as the {@code
 * event_type} tag in serialized envelopes. Types prefixed with {@code system.} are platform-level
 * facts and travel on the system topic; everything else is a tenant domain fact.
 */
public enum EventType {

    // ---- Content ----
    NODE_CREATED("node.created", DomainEvent.NodeCreated.class),
    NODE_UPDATED("node.updated", DomainEvent.NodeUpdated.class),
    NODE_PUBLISHED("node.published", DomainEvent.NodePublished.class),
    NODE_DELETED("node.deleted", DomainEvent.NodeDeleted.class),

    // ---- Commerce ----
    PRODUCT_CREATED("product.created", DomainEvent.ProductCreated.class),
    PRODUCT_UPDATED("product.updated", DomainEvent.ProductUpdated.class),
    ORDER_CREATED("order.created", DomainEvent.OrderCreated.class),
    ORDER_PAID("order.paid", DomainEvent.OrderPaid.class),

    // ---- Modules ----
    MODULE_ENABLED("module.enabled", DomainEvent.ModuleEnabled.class),
    MODULE_DISABLED("module.disabled", DomainEvent.ModuleDisabled.class),

    // ---- Platform ----
    TENANT_CREATED("system.tenant.created", DomainEvent.TenantCreated.class),
    REINDEX_REQUESTED("system.reindex.requested", DomainEvent.ReindexRequested.class);

    /** Prefix shared by all platform-level event types. */
    public static final String SYSTEM_PREFIX = "system.";

    private final String value;
    private final Class<? extends DomainEvent> payloadType;

    EventType(String value, Class<? extends DomainEvent> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    /** The canonical string representation (e.g. "node.created"). */
    public String value() {
        return value;
    }

    /** The record class carrying this event's fields. */
    public Class<? extends DomainEvent> payloadType() {
        return payloadType;
    }

    /** True for platform-level events ({@code system.*}). */
    public boolean isSystem() {
        return value.startsWith(SYSTEM_PREFIX);
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "order.paid")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
