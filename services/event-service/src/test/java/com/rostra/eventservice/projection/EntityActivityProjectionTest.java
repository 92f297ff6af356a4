package com.rostra.eventservice.projection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rostra.eventbus.testing.TestEvents;
import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventType;
import com.rostra.eventservice.projection.EntityActivity.EntityKind;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EntityActivityProjection")
class EntityActivityProjectionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final EntityActivityProjection projection = new EntityActivityProjection();

    private static EventEnvelope envelope(DomainEvent event, Instant occurredAt) {
        return new EventEnvelope(UUID.randomUUID(), TestEvents.TENANT, TestEvents.ACTOR, occurredAt, event);
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("accepts node, product and order events")
        void acceptsEntityEvents() {
            assertThat(projection.matches(TestEvents.nodeCreated())).isTrue();
            assertThat(projection.matches(TestEvents.productCreated(UUID.randomUUID()))).isTrue();
            assertThat(projection.matches(TestEvents.orderPaid(UUID.randomUUID()))).isTrue();
        }

        @Test
        @DisplayName("ignores tenant and module events")
        void ignoresEventsWithoutEntity() {
            assertThat(projection.matches(TestEvents.tenantCreated("acme"))).isFalse();
            assertThat(projection.matches(new DomainEvent.ModuleEnabled("commerce"))).isFalse();
        }
    }

    @Test
    @DisplayName("records the first event for an entity")
    void recordsFirstEvent() {
        UUID nodeId = UUID.randomUUID();

        projection.handle(envelope(TestEvents.nodeCreated(nodeId), T0));

        EntityActivity activity = projection.get(nodeId);
        assertThat(activity.kind()).isEqualTo(EntityKind.NODE);
        assertThat(activity.tenantId()).isEqualTo(TestEvents.TENANT);
        assertThat(activity.lastEventType()).isEqualTo(EventType.NODE_CREATED);
        assertThat(activity.label()).isEqualTo("post");
    }

    @Test
    @DisplayName("advances to the latest event for the entity")
    void advancesToLatest() {
        UUID orderId = UUID.randomUUID();
        projection.handle(envelope(TestEvents.orderCreated(orderId), T0));
        projection.handle(envelope(TestEvents.orderPaid(orderId), T0.plusSeconds(5)));

        EntityActivity activity = projection.get(orderId);
        assertThat(activity.lastEventType()).isEqualTo(EventType.ORDER_PAID);
        assertThat(activity.label()).isNull();
        assertThat(projection.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("replaying the same envelope changes nothing")
    void idempotentReplay() {
        UUID productId = UUID.randomUUID();
        EventEnvelope created = envelope(TestEvents.productCreated(productId), T0);

        projection.handle(created);
        EntityActivity first = projection.get(productId);
        projection.handle(created);

        assertThat(projection.get(productId)).isEqualTo(first);
        assertThat(projection.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("the same fact delivered in two envelopes leaves the entry unchanged")
    void idempotentForRepeatedFact() {
        UUID nodeId = UUID.randomUUID();
        DomainEvent fact = TestEvents.nodeCreated(nodeId);

        projection.handle(envelope(fact, T0));
        EntityActivity first = projection.get(nodeId);
        projection.handle(envelope(fact, T0.plusSeconds(30)));

        assertThat(projection.get(nodeId)).isEqualTo(first);
        assertThat(projection.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("get throws for an unknown entity, find returns empty")
    void unknownEntity() {
        UUID unknown = UUID.randomUUID();

        assertThat(projection.find(unknown)).isEmpty();
        assertThatThrownBy(() -> projection.get(unknown))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining(unknown.toString());
    }
}
