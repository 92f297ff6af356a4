package com.rostra.eventtransport.config;

/**
 * Shape of the provisioned topics.
 *
 * @param domainPartitions partitions of the domain topic
 * @param replicationFactor replicas per partition on the remote broker
 */
public record TopologyConfig(int domainPartitions, int replicationFactor) {

    public static final int DEFAULT_DOMAIN_PARTITIONS = 4;
    public static final int DEFAULT_REPLICATION_FACTOR = 1;

    public TopologyConfig {
        if (domainPartitions < 1) {
            throw new IllegalArgumentException("domainPartitions must be at least 1, was " + domainPartitions);
        }
        if (replicationFactor < 1 || replicationFactor > Short.MAX_VALUE) {
            throw new IllegalArgumentException("replicationFactor must be between 1 and "
                    + Short.MAX_VALUE + ", was " + replicationFactor);
        }
    }

    public static TopologyConfig defaults() {
        return new TopologyConfig(DEFAULT_DOMAIN_PARTITIONS, DEFAULT_REPLICATION_FACTOR);
    }
}
