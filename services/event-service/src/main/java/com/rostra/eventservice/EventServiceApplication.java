package com.rostra.eventservice;

import com.rostra.eventservice.config.EventBusProperties;
import com.rostra.eventservice.config.EventServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Rostra event service.
 *
 * <p>Owns the process-wide event pipeline: one {@link com.rostra.eventbus.EventBus}, a dispatcher
 * running every {@link com.rostra.eventbus.EventHandler} bean, and, when a transport is configured,
 * a forwarder copying every event to the stream. Also exposes:
 *
 * <ul>
 *   <li>{@code POST /api/v1/events} for admin tooling to publish events
 *   <li>{@code GET /api/v1/events/status} and entity activity lookups
 *   <li>Actuator health (including the transport) and Prometheus metrics
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({EventServiceProperties.class, EventBusProperties.class})
public class EventServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(EventServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EventServiceApplication.class, args);
        log.info("Rostra event service started");
    }
}
