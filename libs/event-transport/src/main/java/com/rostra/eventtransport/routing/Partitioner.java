package com.rostra.eventtransport.routing;

import java.nio.charset.StandardCharsets;
import org.apache.kafka.common.utils.Utils;

/**
 * Maps partition keys to partitions with the murmur2 hash used by Kafka's default partitioner, so
 * the embedded engine and a remote broker place a tenant in the same partition.
 */
public final class Partitioner {

    private Partitioner() {}

    public static int partitionFor(String key, int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be at least 1, was " + partitions);
        }
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        return Utils.toPositive(Utils.murmur2(bytes)) % partitions;
    }
}
