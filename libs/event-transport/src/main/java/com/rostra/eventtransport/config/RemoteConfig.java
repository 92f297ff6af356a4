package com.rostra.eventtransport.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Connection settings for the remote broker.
 *
 * @param endpoint bootstrap address, {@code host:port}
 * @param protocol {@code tcp} for plaintext or {@code tls}
 * @param requestTimeout upper bound for admin calls and acknowledged appends
 */
public record RemoteConfig(String endpoint, String protocol, Duration requestTimeout) {

    public static final String DEFAULT_ENDPOINT = "127.0.0.1:9092";
    public static final String DEFAULT_PROTOCOL = "tcp";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public RemoteConfig {
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (protocol == null || protocol.isBlank()) {
            protocol = DEFAULT_PROTOCOL;
        }
        protocol = protocol.trim().toLowerCase(Locale.ROOT);
        securityProtocolFor(protocol);
        if (requestTimeout == null) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive, was " + requestTimeout);
        }
    }

    public static RemoteConfig defaults() {
        return new RemoteConfig(DEFAULT_ENDPOINT, DEFAULT_PROTOCOL, DEFAULT_REQUEST_TIMEOUT);
    }

    /** The Kafka {@code security.protocol} value for {@link #protocol()}. */
    public String securityProtocol() {
        return securityProtocolFor(protocol);
    }

    private static String securityProtocolFor(String protocol) {
        return switch (protocol) {
            case "tcp" -> "PLAINTEXT";
            case "tls" -> "SSL";
            default -> throw new IllegalArgumentException(
                    "unsupported protocol '" + protocol + "', expected tcp or tls");
        };
    }
}
