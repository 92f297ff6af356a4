package com.rostra.observability;

import java.time.Duration;

/**
 * Metrics sink for the event pipeline.
 *
 * <p>The bus, dispatcher, forwarder and transport receive an instance through their constructors;
 * the application's composition root owns its lifetime. Label values are plain strings so the sink
 * stays independent of the event model.
 */
public interface EventMetrics {

    /** An envelope was accepted by the bus. */
    void eventPublished(String eventType);

    /** {@code count} envelopes were discarded for a lagging subscriber. */
    void eventDropped(String subscriber, long count);

    /** The number of live bus subscriptions changed. */
    void subscribersChanged(int count);

    /** A subscriber observed a gap of {@code missed} envelopes; sinks count the envelopes, not the gap. */
    void subscriberLagged(String subscriber, long missed);

    /** A handler completed normally. */
    void handlerSucceeded(String handler, Duration duration);

    /** A handler failed; labelled the way module errors are labelled platform-wide. */
    void handlerError(String module, String handler, String errorType, String severity);

    /** An envelope reached the external transport. */
    void transportPublished(String topic, Duration duration);

    /** The external transport rejected or failed to accept an envelope. */
    void transportFailed(String topic, String errorType);

    /** A sink that records nothing, for wiring without a meter registry. */
    static EventMetrics noop() {
        return NoopEventMetrics.INSTANCE;
    }
}
