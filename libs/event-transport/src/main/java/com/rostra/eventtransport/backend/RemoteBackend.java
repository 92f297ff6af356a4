package com.rostra.eventtransport.backend;

import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventtransport.config.RemoteConfig;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka broker backend.
 *
 * <p>{@link Admin} checks connectivity and provisions topics; a {@link Producer} with
 * {@code acks=all} and idempotence appends records keyed by tenant. Every blocking call is bounded
 * by the configured request timeout.
 */
public final class RemoteBackend implements StreamBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteBackend.class);

    private static final String CLIENT_ID = "rostra-event-transport";

    private final RemoteConfig config;
    private final Function<Properties, Admin> adminFactory;
    private final Function<Properties, Producer<String, String>> producerFactory;
    private Admin admin;
    private Producer<String, String> producer;

    public RemoteBackend(RemoteConfig config) {
        this(config, Admin::create, props -> new KafkaProducer<>(props));
    }

    /** Creates a backend whose clients come from the given factories. */
    public RemoteBackend(
            RemoteConfig config,
            Function<Properties, Admin> adminFactory,
            Function<Properties, Producer<String, String>> producerFactory) {
        this.config = config;
        this.adminFactory = adminFactory;
        this.producerFactory = producerFactory;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public synchronized void connect() throws TransportException {
        log.info("Connecting to broker at {} ({})", config.endpoint(), config.securityProtocol());
        try {
            admin = adminFactory.apply(adminProperties());
            Collection<Node> nodes = await(admin.describeCluster().nodes());
            if (nodes.isEmpty()) {
                throw new TransportException(
                        TransportException.Kind.CONNECT, "broker at " + config.endpoint() + " reports no nodes");
            }
            producer = producerFactory.apply(producerProperties());
            log.info("Connected to broker cluster with {} node(s)", nodes.size());
        } catch (ExecutionException e) {
            throw new TransportException(TransportException.Kind.CONNECT,
                    "cannot reach broker at " + config.endpoint(), e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Kind.CONNECT,
                    "timed out connecting to broker at " + config.endpoint(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.CONNECT, "interrupted while connecting", e);
        } catch (RuntimeException e) {
            throw new TransportException(TransportException.Kind.CONNECT,
                    "cannot create broker clients for " + config.endpoint(), e);
        }
    }

    @Override
    public synchronized void ensureTopic(String topic, int partitions, int replicationFactor)
            throws TransportException {
        requireConnected(TransportException.Kind.TOPOLOGY);
        try {
            Map<String, TopicDescription> existing = await(admin.describeTopics(List.of(topic)).allTopicNames());
            int actual = existing.get(topic).partitions().size();
            if (actual != partitions) {
                throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                        "topic " + topic + " has " + actual + " partitions, expected " + partitions, null);
            }
            log.debug("Topic {} present with {} partition(s)", topic, actual);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UnknownTopicOrPartitionException) {
                createTopic(topic, partitions, replicationFactor);
            } else {
                throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                        "cannot describe topic " + topic, e.getCause());
            }
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                    "timed out describing topic " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.TOPOLOGY, topic, "interrupted", e);
        }
    }

    @Override
    public void append(String topic, String key, String payload) throws TransportException {
        Producer<String, String> current = producer;
        if (current == null) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic, "backend is not connected", null);
        }
        try {
            await(current.send(new ProducerRecord<>(topic, key, payload)));
        } catch (ExecutionException e) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic,
                    "broker rejected record for " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic,
                    "timed out appending to " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.PUBLISH, topic, "interrupted", e);
        } catch (RuntimeException e) {
            throw new TransportException(TransportException.Kind.PUBLISH, topic,
                    "cannot append to " + topic, e);
        }
    }

    @Override
    public synchronized void shutdown() {
        Duration timeout = config.requestTimeout();
        if (producer != null) {
            try {
                producer.flush();
                producer.close(timeout);
            } catch (RuntimeException e) {
                log.warn("Error closing producer", e);
            }
            producer = null;
        }
        if (admin != null) {
            try {
                admin.close(timeout);
            } catch (RuntimeException e) {
                log.warn("Error closing admin client", e);
            }
            admin = null;
        }
    }

    Properties adminProperties() {
        Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.endpoint());
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, config.securityProtocol());
        props.put(AdminClientConfig.CLIENT_ID_CONFIG, CLIENT_ID + "-admin");
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, Integer.toString(timeoutMs()));
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, Integer.toString(timeoutMs()));
        return props;
    }

    Properties producerProperties() {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.endpoint());
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, config.securityProtocol());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Integer.toString(timeoutMs()));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Integer.toString(timeoutMs()));
        props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Integer.toString(timeoutMs()));
        return props;
    }

    private void createTopic(String topic, int partitions, int replicationFactor) throws TransportException {
        try {
            await(admin.createTopics(List.of(new NewTopic(topic, partitions, (short) replicationFactor))).all());
            log.info("Created topic {} with {} partition(s), replication factor {}",
                    topic, partitions, replicationFactor);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.debug("Topic {} created concurrently", topic);
                return;
            }
            throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                    "cannot create topic " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                    "timed out creating topic " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.TOPOLOGY, topic, "interrupted", e);
        }
    }

    private void requireConnected(TransportException.Kind kind) throws TransportException {
        if (admin == null) {
            throw new TransportException(kind, "backend is not connected");
        }
    }

    private <T> T await(Future<T> future) throws ExecutionException, TimeoutException, InterruptedException {
        return future.get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private int timeoutMs() {
        return (int) Math.min(Integer.MAX_VALUE, config.requestTimeout().toMillis());
    }
}
