package com.rostra.eventservice.infrastructure.health;

import com.rostra.eventservice.pipeline.EventTransportBootstrap;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the external transport under {@code /actuator/health/eventTransport}.
 *
 * <p>Local-only operation is a supported mode, so it reports UP with {@code local-only} rather
 * than DOWN. A transport that was closed after startup reports DOWN.
 */
@Component("eventTransport")
public class EventTransportHealthIndicator implements HealthIndicator {

    static final String LOCAL_ONLY = "local-only";

    private final EventTransportBootstrap bootstrap;

    public EventTransportHealthIndicator(EventTransportBootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    @Override
    public Health health() {
        return bootstrap.transport()
                .map(transport -> {
                    Health.Builder builder = transport.isClosed() ? Health.down() : Health.up();
                    return builder
                            .withDetail("mode", transport.mode().name().toLowerCase())
                            .withDetail("stream", transport.stream())
                            .withDetail("reliability", transport.reliabilityLevel().name())
                            .withDetail("backend", transport.backend().name())
                            .build();
                })
                .orElseGet(() -> {
                    Health.Builder builder = Health.up().withDetail("mode", LOCAL_ONLY);
                    bootstrap.failure().ifPresent(reason -> builder.withDetail("failure", reason));
                    return builder.build();
                });
    }
}
