package com.rostra.eventtransport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.rostra.eventbus.testing.TestEvents;
import com.rostra.eventmodel.EventEnvelope;
import com.rostra.eventmodel.EventFactory;
import com.rostra.eventmodel.EventSerializer;
import com.rostra.eventtransport.config.RemoteConfig;
import com.rostra.eventtransport.config.TopologyConfig;
import com.rostra.eventtransport.config.TransportConfig;
import com.rostra.eventtransport.config.TransportMode;
import com.rostra.observability.testing.InMemoryEventMetrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Runs the remote backend against a real broker; skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("StreamTransport against Kafka")
class RemoteStreamTransportContainerTest {

    @Container
    static final KafkaContainer KAFKA = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @Test
    @DisplayName("should provision the topology and append readable envelopes")
    void shouldProvisionAndAppend() throws Exception {
        TransportConfig config = new TransportConfig(
                TransportMode.REMOTE,
                "rostra-it",
                new RemoteConfig(KAFKA.getBootstrapServers(), "tcp", Duration.ofSeconds(30)),
                null,
                new TopologyConfig(3, 1));
        InMemoryEventMetrics metrics = new InMemoryEventMetrics();
        EventEnvelope envelope = EventFactory.create(TestEvents.TENANT, TestEvents.ACTOR, TestEvents.nodeCreated());

        try (StreamTransport transport = StreamTransport.create(config, metrics)) {
            transport.publish(envelope);
        }

        Properties adminProps = new Properties();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
        try (Admin admin = Admin.create(adminProps)) {
            assertThat(admin.describeTopics(List.of("rostra-it.domain")).allTopicNames().get()
                            .get("rostra-it.domain").partitions())
                    .hasSize(3);
            assertThat(admin.listTopics().names().get()).contains("rostra-it.system");
        }

        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(consumerProps())) {
            consumer.subscribe(List.of("rostra-it.domain"));
            List<ConsumerRecord<String, String>> received = new ArrayList<>();
            await().atMost(30, TimeUnit.SECONDS).untilAsserted(() -> {
                consumer.poll(Duration.ofMillis(500)).forEach(received::add);
                assertThat(received).hasSize(1);
            });
            ConsumerRecord<String, String> record = received.get(0);
            assertThat(record.key()).isEqualTo(TestEvents.TENANT.toString());
            assertThat(EventSerializer.deserialize(record.value())).isEqualTo(envelope);
        }
    }

    private static Properties consumerProps() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "rostra-it");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }
}
