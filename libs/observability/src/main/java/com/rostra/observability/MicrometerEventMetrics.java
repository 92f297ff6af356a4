package com.rostra.observability;

import java.time.Duration;

/**
 * {@link EventMetrics} backed by Micrometer through {@link MetricFactory}.
 *
 * <p>Meter names:
 *
 * <ul>
 *   <li>{@code rostra.eventbus.events.published}: counter, tag {@code event_type}
 *   <li>{@code rostra.eventbus.events.dropped}: counter, tag {@code subscriber}
 *   <li>{@code rostra.eventbus.subscribers}: gauge
 *   <li>{@code rostra.eventbus.subscriber.lagged}: counter of skipped envelopes, tag {@code subscriber}
 *   <li>{@code rostra.eventbus.handler.duration}: timer, tag {@code handler}
 *   <li>{@code rostra.eventbus.handler.errors}: counter, tags {@code module}, {@code handler},
 *       {@code error_type}, {@code severity}
 *   <li>{@code rostra.transport.publish.duration}: timer, tag {@code topic}
 *   <li>{@code rostra.transport.publish.failures}: counter, tags {@code topic}, {@code error_type}
 * </ul>
 */
public final class MicrometerEventMetrics implements EventMetrics {

    public static final String EVENTS_PUBLISHED = "rostra.eventbus.events.published";
    public static final String EVENTS_DROPPED = "rostra.eventbus.events.dropped";
    public static final String SUBSCRIBERS = "rostra.eventbus.subscribers";
    public static final String SUBSCRIBER_LAGGED = "rostra.eventbus.subscriber.lagged";
    public static final String HANDLER_DURATION = "rostra.eventbus.handler.duration";
    public static final String HANDLER_ERRORS = "rostra.eventbus.handler.errors";
    public static final String TRANSPORT_DURATION = "rostra.transport.publish.duration";
    public static final String TRANSPORT_FAILURES = "rostra.transport.publish.failures";

    private final MetricFactory factory;

    public MicrometerEventMetrics(MetricFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.factory = factory;
    }

    @Override
    public void eventPublished(String eventType) {
        factory.counter(EVENTS_PUBLISHED, "Events accepted by the event bus", "event_type", eventType)
                .increment();
    }

    @Override
    public void eventDropped(String subscriber, long count) {
        factory.counter(EVENTS_DROPPED, "Envelopes dropped for lagging subscribers", "subscriber", subscriber)
                .increment(count);
    }

    @Override
    public void subscribersChanged(int count) {
        factory.gauge(SUBSCRIBERS, "Live event bus subscriptions").set(count);
    }

    @Override
    public void subscriberLagged(String subscriber, long missed) {
        factory.counter(SUBSCRIBER_LAGGED, "Envelopes a lagging subscriber skipped", "subscriber", subscriber)
                .increment(missed);
    }

    @Override
    public void handlerSucceeded(String handler, Duration duration) {
        factory.timer(HANDLER_DURATION, "Event handler execution time", "handler", handler)
                .record(duration);
    }

    @Override
    public void handlerError(String module, String handler, String errorType, String severity) {
        factory.counter(HANDLER_ERRORS, "Event handler failures",
                        "module", module,
                        "handler", handler,
                        "error_type", errorType,
                        "severity", severity)
                .increment();
    }

    @Override
    public void transportPublished(String topic, Duration duration) {
        factory.timer(TRANSPORT_DURATION, "Transport publish latency", "topic", topic).record(duration);
    }

    @Override
    public void transportFailed(String topic, String errorType) {
        factory.counter(TRANSPORT_FAILURES, "Transport publish failures", "topic", topic, "error_type", errorType)
                .increment();
    }
}
