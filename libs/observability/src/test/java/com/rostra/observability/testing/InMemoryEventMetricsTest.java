package com.rostra.observability.testing;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryEventMetrics")
class InMemoryEventMetricsTest {

    private final InMemoryEventMetrics metrics = new InMemoryEventMetrics();

    @Test
    @DisplayName("should accumulate counts by key")
    void shouldAccumulate() {
        metrics.eventPublished("node.created");
        metrics.eventPublished("node.created");
        metrics.eventDropped("indexer", 4);
        metrics.subscriberLagged("indexer", 4);
        metrics.handlerSucceeded("node-index", Duration.ZERO);

        assertThat(metrics.publishedCount("node.created")).isEqualTo(2);
        assertThat(metrics.publishedCount("order.paid")).isZero();
        assertThat(metrics.totalPublished()).isEqualTo(2);
        assertThat(metrics.droppedCount("indexer")).isEqualTo(4);
        assertThat(metrics.laggedCount("indexer")).isEqualTo(4);
        assertThat(metrics.handlerSuccessCount("node-index")).isEqualTo(1);
    }

    @Test
    @DisplayName("should record failures and forget them on reset")
    void shouldRecordAndReset() {
        metrics.handlerError("content", "node-index", "RuntimeException", "error");
        metrics.transportFailed("domain", "PUBLISH");
        metrics.subscribersChanged(2);

        assertThat(metrics.handlerErrors())
                .containsExactly(new InMemoryEventMetrics.HandlerError("content", "node-index", "RuntimeException", "error"));
        assertThat(metrics.transportFailures()).hasSize(1);
        assertThat(metrics.subscribers()).isEqualTo(2);

        metrics.reset();

        assertThat(metrics.handlerErrors()).isEmpty();
        assertThat(metrics.subscribers()).isZero();
    }
}
