package com.rostra.eventservice.config;

import com.rostra.eventbus.DispatcherOptions;
import com.rostra.eventbus.EventBus;
import com.rostra.eventtransport.config.EmbeddedConfig;
import com.rostra.eventtransport.config.RemoteConfig;
import com.rostra.eventtransport.config.TopologyConfig;
import com.rostra.eventtransport.config.TransportConfig;
import com.rostra.eventtransport.config.TransportMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Event pipeline settings, bound from {@code rostra.events.*}.
 *
 * <pre>
 * rostra:
 *   events:
 *     capacity: 128
 *     poll-interval: 100ms
 *     handler-failure-threshold: 0
 *     transport:
 *       enabled: true
 *       mode: remote
 *       stream: rostra
 *       fail-on-error: true
 *       remote:
 *         endpoint: kafka:9092
 *         protocol: tcp
 *       topology:
 *         domain-partitions: 4
 *         replication-factor: 1
 * </pre>
 *
 * @param capacity per-subscriber buffer size
 * @param pollInterval how often idle dispatcher and forwarder loops recheck for shutdown
 * @param handlerFailureThreshold consecutive failures after which a handler is skipped; 0 never
 * @param transport external stream settings
 */
@ConfigurationProperties(prefix = "rostra.events")
@Validated
public record EventBusProperties(
        @Min(1) int capacity,
        Duration pollInterval,
        @Min(0) int handlerFailureThreshold,
        @Valid Transport transport) {

    public EventBusProperties {
        if (capacity == 0) {
            capacity = EventBus.DEFAULT_CAPACITY;
        }
        if (pollInterval == null) {
            pollInterval = DispatcherOptions.DEFAULT_POLL_INTERVAL;
        }
        if (transport == null) {
            transport = new Transport(false, null, null, false, null, null, 0);
        }
    }

    public DispatcherOptions dispatcherOptions() {
        return new DispatcherOptions(pollInterval, handlerFailureThreshold);
    }

    /**
     * External stream settings.
     *
     * @param enabled false runs the bus in local in-memory mode
     * @param mode {@code embedded} or {@code remote}
     * @param stream topic namespace
     * @param failOnError refuse to start when the transport cannot be brought up
     * @param remote broker connection
     * @param topology topic shape
     * @param retentionPerPartition records the embedded engine keeps per partition
     */
    public record Transport(
            boolean enabled,
            String mode,
            @NotBlank String stream,
            boolean failOnError,
            Remote remote,
            Topology topology,
            int retentionPerPartition) {

        public Transport {
            if (mode == null || mode.isBlank()) {
                mode = "embedded";
            }
            if (stream == null || stream.isBlank()) {
                stream = "rostra";
            }
            if (remote == null) {
                remote = new Remote(null, null, null);
            }
            if (topology == null) {
                topology = new Topology(0, 0);
            }
            if (retentionPerPartition <= 0) {
                retentionPerPartition = EmbeddedConfig.DEFAULT_RETENTION;
            }
        }

        /**
         * @throws IllegalArgumentException if the mode, protocol or numbers are invalid
         */
        public TransportConfig toTransportConfig() {
            return new TransportConfig(
                    TransportMode.fromString(mode),
                    stream,
                    new RemoteConfig(remote.endpoint(), remote.protocol(), remote.requestTimeout()),
                    new EmbeddedConfig(retentionPerPartition),
                    new TopologyConfig(topology.domainPartitions(), topology.replicationFactor()));
        }
    }

    /** Broker connection; blank values fall back to the transport defaults. */
    public record Remote(String endpoint, String protocol, Duration requestTimeout) {}

    /** Topic shape; zero values fall back to the transport defaults. */
    public record Topology(int domainPartitions, int replicationFactor) {

        public Topology {
            if (domainPartitions == 0) {
                domainPartitions = TopologyConfig.DEFAULT_DOMAIN_PARTITIONS;
            }
            if (replicationFactor == 0) {
                replicationFactor = TopologyConfig.DEFAULT_REPLICATION_FACTOR;
            }
        }
    }
}
