package com.rostra.eventbus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rostra.eventbus.testing.TestEvents;
import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventValidationError;
import com.rostra.observability.EventMetrics;
import com.rostra.observability.testing.InMemoryEventMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventBus")
class EventBusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private InMemoryEventMetrics metrics;
    private EventBus bus;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryEventMetrics();
        bus = new EventBus(16, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject non-positive capacity")
        void shouldRejectNonPositiveCapacity() {
            assertThatThrownBy(() -> new EventBus(0, EventMetrics.noop()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("capacity");
        }

        @Test
        @DisplayName("should default to capacity 128")
        void shouldDefaultCapacity() {
            assertThat(new EventBus().capacity()).isEqualTo(EventBus.DEFAULT_CAPACITY).isEqualTo(128);
        }
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("should deliver the same envelope to every subscriber")
        void shouldFanOut() throws Exception {
            EventSubscription first = bus.subscribe("first");
            EventSubscription second = bus.subscribe("second");
            UUID nodeId = UUID.randomUUID();

            UUID id = bus.publish(TestEvents.TENANT, TestEvents.ACTOR, TestEvents.nodeCreated(nodeId));

            EventEnvelope a = first.receive();
            EventEnvelope b = second.receive();
            assertThat(a).isSameAs(b);
            assertThat(a.id()).isEqualTo(id);
            assertThat(a.tenantId()).isEqualTo(TestEvents.TENANT);
            assertThat(a.actorId()).isEqualTo(TestEvents.ACTOR);
            assertThat(a.occurredAt()).isEqualTo(NOW);
            assertThat(a.event()).isEqualTo(TestEvents.nodeCreated(nodeId));
        }

        @Test
        @DisplayName("should preserve publish order for each subscriber")
        void shouldPreserveOrder() throws Exception {
            EventSubscription subscription = bus.subscribe("ordered");
            List<UUID> ids = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                ids.add(bus.publish(TestEvents.TENANT, null, TestEvents.nodeCreated()));
            }

            List<UUID> received = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                received.add(subscription.receive().id());
            }
            assertThat(received).containsExactlyElementsOf(ids);
        }

        @Test
        @DisplayName("should succeed with no subscribers")
        void shouldSucceedWithoutSubscribers() {
            UUID id = bus.publish(TestEvents.TENANT, null, TestEvents.tenantCreated("acme"));

            assertThat(id).isNotNull();
            assertThat(metrics.publishedCount("system.tenant.created")).isEqualTo(1);
        }

        @Test
        @DisplayName("should assign a fresh id per publish")
        void shouldAssignFreshIds() {
            DomainEvent event = TestEvents.nodeCreated();

            UUID first = bus.publish(TestEvents.TENANT, null, event);
            UUID second = bus.publish(TestEvents.TENANT, null, event);

            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("should not deliver to subscriptions opened afterwards")
        void shouldNotReplay() throws Exception {
            bus.publish(TestEvents.TENANT, null, TestEvents.nodeCreated());
            EventSubscription late = bus.subscribe("late");

            assertThat(late.poll(Duration.ofMillis(20))).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject an invalid event without delivering it")
        void shouldRejectInvalidEvent() throws Exception {
            EventSubscription subscription = bus.subscribe("watcher");
            DomainEvent invalid = new DomainEvent.NodeCreated(UUID.randomUUID(), "", null);

            assertThatThrownBy(() -> bus.publish(TestEvents.TENANT, null, invalid))
                    .isInstanceOf(InvalidEventException.class)
                    .isInstanceOf(IllegalArgumentException.class)
                    .satisfies(e -> assertThat(((InvalidEventException) e).errors())
                            .extracting(EventValidationError::field)
                            .containsExactly("kind"));

            assertThat(subscription.tryReceive()).isEmpty();
            assertThat(metrics.totalPublished()).isZero();
        }

        @Test
        @DisplayName("should reject a null event")
        void shouldRejectNullEvent() {
            assertThatThrownBy(() -> bus.publish(TestEvents.TENANT, null, null))
                    .isInstanceOf(InvalidEventException.class)
                    .hasMessageContaining("event");
        }

        @Test
        @DisplayName("should reject a nil tenant id")
        void shouldRejectNilTenant() {
            assertThatThrownBy(() -> bus.publish(new UUID(0, 0), null, TestEvents.nodeCreated()))
                    .isInstanceOf(InvalidEventException.class)
                    .hasMessageContaining("tenant_id");
        }

        @Test
        @DisplayName("should report every violation at once")
        void shouldReportAllViolations() {
            DomainEvent invalid = new DomainEvent.ProductCreated(new UUID(0, 0), "", "t", -1, "EURO");

            assertThatThrownBy(() -> bus.publish(null, null, invalid))
                    .isInstanceOfSatisfying(InvalidEventException.class, e -> assertThat(e.errors())
                            .extracting(EventValidationError::field)
                            .containsExactly("tenant_id", "product_id", "sku", "price", "currency"));
        }
    }

    @Nested
    @DisplayName("subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("should track subscriber count and report it")
        void shouldTrackSubscriberCount() {
            EventSubscription a = bus.subscribe();
            EventSubscription b = bus.subscribe();
            assertThat(bus.subscriberCount()).isEqualTo(2);
            assertThat(metrics.subscribers()).isEqualTo(2);

            a.close();
            a.close();

            assertThat(bus.subscriberCount()).isEqualTo(1);
            assertThat(metrics.subscribers()).isEqualTo(1);
            assertThat(a.name()).isNotEqualTo(b.name());
        }

        @Test
        @DisplayName("should stop delivering to a closed subscription")
        void shouldStopDeliveringAfterClose() throws Exception {
            EventSubscription subscription = bus.subscribe("closing");
            subscription.close();

            bus.publish(TestEvents.TENANT, null, TestEvents.nodeCreated());

            assertThat(subscription.poll(Duration.ofMillis(10))).isEmpty();
        }
    }

    @Nested
    @DisplayName("close")
    class Close {

        @Test
        @DisplayName("should let readers drain and then observe closure")
        void shouldDrainThenClose() throws Exception {
            EventSubscription subscription = bus.subscribe("drain");
            UUID id = bus.publish(TestEvents.TENANT, null, TestEvents.nodeCreated());

            bus.close();

            assertThat(subscription.receive().id()).isEqualTo(id);
            assertThatThrownBy(subscription::receive).isInstanceOf(SubscriptionClosedException.class);
            assertThat(bus.subscriberCount()).isZero();
        }

        @Test
        @DisplayName("should refuse publish and subscribe after close")
        void shouldRefuseAfterClose() {
            bus.close();
            bus.close();

            assertThat(bus.isClosed()).isTrue();
            assertThatThrownBy(() -> bus.publish(TestEvents.TENANT, null, TestEvents.nodeCreated()))
                    .isInstanceOf(EventBusClosedException.class);
            assertThatThrownBy(() -> bus.subscribe("late")).isInstanceOf(EventBusClosedException.class);
        }
    }
}
