package com.rostra.eventmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

/**
 * An immutable business fact that already happened.
 *
 * <p>The set of variants is closed: every variant is a record nested in this interface and carries
 * only the fields needed to reconstruct the fact. Field names are pinned with {@link JsonProperty}
 * so the serialized {@code data} object stays stable for consumers outside this codebase.
 *
 * <p>Money amounts are integer minor units (cents) to avoid floating-point drift.
 */
public sealed interface DomainEvent
        permits DomainEvent.NodeCreated,
                DomainEvent.NodeUpdated,
                DomainEvent.NodePublished,
                DomainEvent.NodeDeleted,
                DomainEvent.ProductCreated,
                DomainEvent.ProductUpdated,
                DomainEvent.OrderCreated,
                DomainEvent.OrderPaid,
                DomainEvent.ModuleEnabled,
                DomainEvent.ModuleDisabled,
                DomainEvent.TenantCreated,
                DomainEvent.ReindexRequested {

    int MAX_KIND_LENGTH = 64;
    int MAX_SLUG_LENGTH = 64;
    int MAX_SKU_LENGTH = 64;
    int MAX_TITLE_LENGTH = 255;
    int MAX_CURRENCY_LENGTH = 3;
    int MAX_TARGET_LENGTH = 64;

    /** The routing and serialization tag of this variant. */
    @JsonIgnore
    EventType eventType();

    /** Checks field invariants; called before the event is admitted to the bus. */
    ValidationResult validate();

    // ---- Content ----

    record NodeCreated(
            @JsonProperty("node_id") UUID nodeId,
            @JsonProperty("kind") String kind,
            @JsonProperty("author_id") UUID authorId)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.NODE_CREATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("node_id", nodeId)
                    .notEmpty("kind", kind)
                    .maxLength("kind", kind, MAX_KIND_LENGTH)
                    .result();
        }
    }

    record NodeUpdated(@JsonProperty("node_id") UUID nodeId, @JsonProperty("kind") String kind)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.NODE_UPDATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("node_id", nodeId)
                    .notEmpty("kind", kind)
                    .maxLength("kind", kind, MAX_KIND_LENGTH)
                    .result();
        }
    }

    record NodePublished(
            @JsonProperty("node_id") UUID nodeId,
            @JsonProperty("kind") String kind,
            @JsonProperty("author_id") UUID authorId)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.NODE_PUBLISHED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("node_id", nodeId)
                    .notEmpty("kind", kind)
                    .maxLength("kind", kind, MAX_KIND_LENGTH)
                    .result();
        }
    }

    record NodeDeleted(@JsonProperty("node_id") UUID nodeId, @JsonProperty("kind") String kind)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.NODE_DELETED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("node_id", nodeId)
                    .notEmpty("kind", kind)
                    .maxLength("kind", kind, MAX_KIND_LENGTH)
                    .result();
        }
    }

    // ---- Commerce ----

    record ProductCreated(
            @JsonProperty("product_id") UUID productId,
            @JsonProperty("sku") String sku,
            @JsonProperty("title") String title,
            @JsonProperty(value = "price", required = true) long price,
            @JsonProperty("currency") String currency)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.PRODUCT_CREATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("product_id", productId)
                    .notEmpty("sku", sku)
                    .maxLength("sku", sku, MAX_SKU_LENGTH)
                    .notEmpty("title", title)
                    .maxLength("title", title, MAX_TITLE_LENGTH)
                    .nonNegative("price", price)
                    .notEmpty("currency", currency)
                    .maxLength("currency", currency, MAX_CURRENCY_LENGTH)
                    .result();
        }
    }

    record ProductUpdated(
            @JsonProperty("product_id") UUID productId,
            @JsonProperty("sku") String sku,
            @JsonProperty("title") String title,
            @JsonProperty(value = "price", required = true) long price,
            @JsonProperty("currency") String currency)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.PRODUCT_UPDATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("product_id", productId)
                    .notEmpty("sku", sku)
                    .maxLength("sku", sku, MAX_SKU_LENGTH)
                    .notEmpty("title", title)
                    .maxLength("title", title, MAX_TITLE_LENGTH)
                    .nonNegative("price", price)
                    .notEmpty("currency", currency)
                    .maxLength("currency", currency, MAX_CURRENCY_LENGTH)
                    .result();
        }
    }

    record OrderCreated(
            @JsonProperty("order_id") UUID orderId,
            @JsonProperty("customer_id") UUID customerId,
            @JsonProperty(value = "total", required = true) long total,
            @JsonProperty("currency") String currency)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.ORDER_CREATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("order_id", orderId)
                    .notNilUuid("customer_id", customerId)
                    .nonNegative("total", total)
                    .notEmpty("currency", currency)
                    .maxLength("currency", currency, MAX_CURRENCY_LENGTH)
                    .result();
        }
    }

    record OrderPaid(
            @JsonProperty("order_id") UUID orderId,
            @JsonProperty("payment_id") UUID paymentId,
            @JsonProperty(value = "amount", required = true) long amount,
            @JsonProperty("currency") String currency)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.ORDER_PAID;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notNilUuid("order_id", orderId)
                    .notNilUuid("payment_id", paymentId)
                    .nonNegative("amount", amount)
                    .notEmpty("currency", currency)
                    .maxLength("currency", currency, MAX_CURRENCY_LENGTH)
                    .result();
        }
    }

    // ---- Modules ----

    record ModuleEnabled(@JsonProperty("module_slug") String moduleSlug) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.MODULE_ENABLED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notEmpty("module_slug", moduleSlug)
                    .maxLength("module_slug", moduleSlug, MAX_SLUG_LENGTH)
                    .result();
        }
    }

    record ModuleDisabled(@JsonProperty("module_slug") String moduleSlug) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.MODULE_DISABLED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notEmpty("module_slug", moduleSlug)
                    .maxLength("module_slug", moduleSlug, MAX_SLUG_LENGTH)
                    .result();
        }
    }

    // ---- Platform ----

    record TenantCreated(@JsonProperty("tenant_slug") String tenantSlug) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.TENANT_CREATED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notEmpty("tenant_slug", tenantSlug)
                    .maxLength("tenant_slug", tenantSlug, MAX_SLUG_LENGTH)
                    .result();
        }
    }

    record ReindexRequested(
            @JsonProperty("target") String target,
            @JsonProperty("requested_by") UUID requestedBy)
            implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.REINDEX_REQUESTED;
        }

        @Override
        public ValidationResult validate() {
            return EventValidator.check()
                    .notEmpty("target", target)
                    .maxLength("target", target, MAX_TARGET_LENGTH)
                    .result();
        }
    }
}
