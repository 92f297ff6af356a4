package com.rostra.eventtransport.routing;

import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventtransport.backend.StreamBackend;
import com.rostra.eventtransport.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topics a stream needs and their shape.
 *
 * <p>The domain topic is partitioned as configured; the system topic has a single partition so
 * platform facts keep one global order.
 *
 * @param stream namespace of the topics
 * @param domainPartitions partitions of the domain topic
 * @param replicationFactor replicas per partition
 */
public record StreamTopology(String stream, int domainPartitions, int replicationFactor) {

    private static final Logger log = LoggerFactory.getLogger(StreamTopology.class);

    public static final int SYSTEM_PARTITIONS = 1;

    public static StreamTopology from(TransportConfig config) {
        return new StreamTopology(
                config.stream(),
                config.topology().domainPartitions(),
                config.topology().replicationFactor());
    }

    public int partitionsFor(StreamTopic topic) {
        return topic == StreamTopic.SYSTEM ? SYSTEM_PARTITIONS : domainPartitions;
    }

    /**
     * Creates missing topics. Idempotent.
     *
     * @throws TransportException of kind TOPOLOGY if a topic exists with a different shape
     */
    public void ensure(StreamBackend backend) throws TransportException {
        log.debug("Ensuring topology of stream '{}': domain partitions {}, replication factor {}",
                stream, domainPartitions, replicationFactor);
        for (StreamTopic topic : StreamTopic.values()) {
            backend.ensureTopic(topic.physicalName(stream), partitionsFor(topic), replicationFactor);
        }
    }
}
