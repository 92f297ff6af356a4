package com.rostra.eventtransport.backend;

import com.rostra.eventbus.transport.TransportException;

/**
 * Storage engine behind a {@link com.rostra.eventtransport.StreamTransport}.
 *
 * <p>Call order is {@link #connect()}, then {@link #ensureTopic} for every topic, then any number of
 * {@link #append} calls, then {@link #shutdown()}.
 */
public interface StreamBackend {

    /** Short name for logs and health output. */
    String name();

    void connect() throws TransportException;

    /**
     * Creates the topic if it does not exist.
     *
     * @throws TransportException of kind TOPOLOGY if it exists with a different partition count
     */
    void ensureTopic(String topic, int partitions, int replicationFactor) throws TransportException;

    /** Appends one record; returns once the engine has accepted it. */
    void append(String topic, String key, String payload) throws TransportException;

    /** Releases resources. Idempotent; never throws. */
    void shutdown();
}
