package com.rostra.observability;

import java.time.Duration;

/** Discards every observation. */
enum NoopEventMetrics implements EventMetrics {
    INSTANCE;

    @Override
    public void eventPublished(String eventType) {}

    @Override
    public void eventDropped(String subscriber, long count) {}

    @Override
    public void subscribersChanged(int count) {}

    @Override
    public void subscriberLagged(String subscriber, long missed) {}

    @Override
    public void handlerSucceeded(String handler, Duration duration) {}

    @Override
    public void handlerError(String module, String handler, String errorType, String severity) {}

    @Override
    public void transportPublished(String topic, Duration duration) {}

    @Override
    public void transportFailed(String topic, String errorType) {}
}
