package com.rostra.eventbus.transport;

import com.rostra.eventmodel.EventEnvelope;

/**
 * Moves envelopes from the in-process bus to an external stream.
 *
 * <p>Implementations are constructed fully connected; a transport instance that exists is ready
 * to publish. {@link #close()} releases the underlying connection.
 */
public interface EventTransport extends AutoCloseable {

    /**
     * Hands one envelope to the external stream.
     *
     * @throws TransportException if the envelope was not accepted
     */
    void publish(EventEnvelope envelope) throws TransportException;

    ReliabilityLevel reliabilityLevel();

    @Override
    default void close() {}
}
