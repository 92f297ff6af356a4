package com.rostra.eventtransport.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TransportConfig")
class TransportConfigTest {

    @Test
    @DisplayName("should fill every omitted section with defaults")
    void shouldApplyDefaults() {
        TransportConfig config = new TransportConfig(null, "rostra", null, null, null);

        assertThat(config.mode()).isEqualTo(TransportMode.EMBEDDED);
        assertThat(config.remote().endpoint()).isEqualTo("127.0.0.1:9092");
        assertThat(config.remote().protocol()).isEqualTo("tcp");
        assertThat(config.remote().requestTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.embedded().retentionPerPartition()).isEqualTo(10_000);
        assertThat(config.topology().domainPartitions()).isEqualTo(4);
        assertThat(config.topology().replicationFactor()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "has space", "dotted.name"})
    @DisplayName("should reject unusable stream names")
    void shouldRejectBadStream(String stream) {
        assertThatThrownBy(() -> TransportConfig.embedded(stream))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stream");
    }

    @Test
    @DisplayName("remote factory should select remote mode with the given endpoint")
    void remoteFactory() {
        TransportConfig config = TransportConfig.remote("rostra", "kafka:9092");

        assertThat(config.mode()).isEqualTo(TransportMode.REMOTE);
        assertThat(config.remote().endpoint()).isEqualTo("kafka:9092");
    }

    @Nested
    @DisplayName("TransportMode")
    class Mode {

        @Test
        @DisplayName("should parse case-insensitively")
        void shouldParse() {
            assertThat(TransportMode.fromString("Remote")).isEqualTo(TransportMode.REMOTE);
            assertThat(TransportMode.fromString(" embedded ")).isEqualTo(TransportMode.EMBEDDED);
        }

        @Test
        @DisplayName("should reject unknown modes")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> TransportMode.fromString("cluster"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cluster");
        }
    }

    @Nested
    @DisplayName("RemoteConfig")
    class Remote {

        @Test
        @DisplayName("should map protocols to security protocols")
        void shouldMapProtocols() {
            assertThat(new RemoteConfig("h:1", "tcp", null).securityProtocol()).isEqualTo("PLAINTEXT");
            assertThat(new RemoteConfig("h:1", "TLS", null).securityProtocol()).isEqualTo("SSL");
        }

        @Test
        @DisplayName("should reject unsupported protocols")
        void shouldRejectProtocol() {
            assertThatThrownBy(() -> new RemoteConfig("h:1", "quic", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("quic");
        }

        @Test
        @DisplayName("should reject a non-positive timeout")
        void shouldRejectTimeout() {
            assertThatThrownBy(() -> new RemoteConfig("h:1", "tcp", Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should reject invalid topology and retention")
    void shouldRejectInvalidNumbers() {
        assertThatThrownBy(() -> new TopologyConfig(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TopologyConfig(4, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmbeddedConfig(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
