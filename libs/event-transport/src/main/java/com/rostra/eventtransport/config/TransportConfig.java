package com.rostra.eventtransport.config;

import java.util.regex.Pattern;

/**
 * Complete configuration of a streaming transport.
 *
 * <p>Missing sections fall back to their defaults; only the stream name is required.
 *
 * @param mode embedded or remote engine
 * @param stream namespace prefixed to every topic name
 * @param remote broker connection, used in remote mode
 * @param embedded in-process engine settings, used in embedded mode
 * @param topology partitioning and replication of the topics
 */
public record TransportConfig(
        TransportMode mode,
        String stream,
        RemoteConfig remote,
        EmbeddedConfig embedded,
        TopologyConfig topology) {

    private static final Pattern STREAM_NAME = Pattern.compile("[A-Za-z0-9_-]{1,200}");

    public TransportConfig {
        if (mode == null) {
            mode = TransportMode.EMBEDDED;
        }
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream must not be null or blank");
        }
        if (!STREAM_NAME.matcher(stream).matches()) {
            throw new IllegalArgumentException(
                    "stream may only contain letters, digits, '_' and '-', was '" + stream + "'");
        }
        if (remote == null) {
            remote = RemoteConfig.defaults();
        }
        if (embedded == null) {
            embedded = EmbeddedConfig.defaults();
        }
        if (topology == null) {
            topology = TopologyConfig.defaults();
        }
    }

    /** Embedded engine with default settings. */
    public static TransportConfig embedded(String stream) {
        return new TransportConfig(TransportMode.EMBEDDED, stream, null, null, null);
    }

    /** Remote broker at {@code endpoint} over plaintext, other settings default. */
    public static TransportConfig remote(String stream, String endpoint) {
        return new TransportConfig(
                TransportMode.REMOTE, stream, new RemoteConfig(endpoint, null, null), null, null);
    }
}
