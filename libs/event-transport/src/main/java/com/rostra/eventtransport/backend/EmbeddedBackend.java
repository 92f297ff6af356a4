package com.rostra.eventtransport.backend;

import com.rostra.eventbus.transport.TransportException;
import com.rostra.eventtransport.config.EmbeddedConfig;
import com.rostra.eventtransport.routing.Partitioner;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process partitioned log.
 *
 * <p>Each topic is a fixed set of append-only partitions. Records get consecutive offsets per
 * partition, starting at 0. Once a partition holds more than the configured retention, its oldest
 * records are discarded; offsets are never reused. Nothing survives the process.
 */
public final class EmbeddedBackend implements StreamBackend {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedBackend.class);

    /** A record as stored in a partition. */
    public record StoredRecord(long offset, String key, String payload, Instant appendedAt) {}

    private final int retention;
    private final Clock clock;
    private final Map<String, Partition[]> topics = new ConcurrentHashMap<>();
    private volatile boolean connected;

    public EmbeddedBackend(EmbeddedConfig config) {
        this(config, Clock.systemUTC());
    }

    public EmbeddedBackend(EmbeddedConfig config, Clock clock) {
        this.retention = config.retentionPerPartition();
        this.clock = clock;
    }

    @Override
    public String name() {
        return "embedded";
    }

    @Override
    public void connect() {
        connected = true;
        log.info("Embedded stream engine started (retention {} per partition)", retention);
    }

    @Override
    public synchronized void ensureTopic(String topic, int partitions, int replicationFactor)
            throws TransportException {
        requireConnected(TransportException.Kind.TOPOLOGY);
        Partition[] existing = topics.get(topic);
        if (existing != null) {
            if (existing.length != partitions) {
                throw new TransportException(TransportException.Kind.TOPOLOGY, topic,
                        "topic " + topic + " has " + existing.length + " partitions, expected " + partitions,
                        null);
            }
            return;
        }
        Partition[] created = new Partition[partitions];
        for (int i = 0; i < partitions; i++) {
            created[i] = new Partition();
        }
        topics.put(topic, created);
        log.debug("Created embedded topic {} with {} partition(s)", topic, partitions);
    }

    @Override
    public void append(String topic, String key, String payload) throws TransportException {
        requireConnected(TransportException.Kind.PUBLISH);
        Partition[] partitions = topics.get(topic);
        if (partitions == null) {
            throw new TransportException(
                    TransportException.Kind.PUBLISH, topic, "unknown topic " + topic, null);
        }
        partitions[Partitioner.partitionFor(key, partitions.length)]
                .append(key, payload, clock.instant(), retention);
    }

    /**
     * Reads up to {@code max} records of one partition starting at {@code fromOffset}. Offsets below
     * the retained range start at the oldest retained record.
     */
    public List<StoredRecord> read(String topic, int partition, long fromOffset, int max) {
        Partition[] partitions = topics.get(topic);
        if (partitions == null) {
            throw new IllegalArgumentException("unknown topic " + topic);
        }
        if (max < 1) {
            throw new IllegalArgumentException("max must be at least 1, was " + max);
        }
        if (partition < 0 || partition >= partitions.length) {
            throw new IllegalArgumentException(
                    "partition " + partition + " out of range for topic " + topic);
        }
        return partitions[partition].read(fromOffset, max);
    }

    /** Offset the next record appended to the partition will get. */
    public long endOffset(String topic, int partition) {
        return Optional.ofNullable(topics.get(topic))
                .map(p -> p[partition].endOffset())
                .orElseThrow(() -> new IllegalArgumentException("unknown topic " + topic));
    }

    public Optional<Integer> partitionCount(String topic) {
        return Optional.ofNullable(topics.get(topic)).map(p -> p.length);
    }

    public Set<String> topics() {
        return Set.copyOf(topics.keySet());
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    public void shutdown() {
        if (connected) {
            connected = false;
            topics.clear();
            log.info("Embedded stream engine stopped");
        }
    }

    private void requireConnected(TransportException.Kind kind) throws TransportException {
        if (!connected) {
            throw new TransportException(kind, "embedded engine is not running");
        }
    }

    private static final class Partition {

        private final ArrayDeque<StoredRecord> records = new ArrayDeque<>();
        private long nextOffset;

        synchronized void append(String key, String payload, Instant at, int retention) {
            records.addLast(new StoredRecord(nextOffset++, key, payload, at));
            while (records.size() > retention) {
                records.pollFirst();
            }
        }

        synchronized List<StoredRecord> read(long fromOffset, int max) {
            List<StoredRecord> result = new ArrayList<>(Math.min(max, records.size()));
            Iterator<StoredRecord> it = records.iterator();
            while (it.hasNext() && result.size() < max) {
                StoredRecord record = it.next();
                if (record.offset() >= fromOffset) {
                    result.add(record);
                }
            }
            return result;
        }

        synchronized long endOffset() {
            return nextOffset;
        }
    }
}
