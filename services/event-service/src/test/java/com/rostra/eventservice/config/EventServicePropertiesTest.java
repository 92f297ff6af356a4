package com.rostra.eventservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventServiceProperties")
class EventServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new EventServiceProperties("event-service", "production", "Events");
        assertThat(props.name()).isEqualTo("event-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Events");
    }

    @Test
    @DisplayName("defaults environment to 'development' and description to empty")
    void appliesDefaults() {
        var props = new EventServiceProperties("event-service", null, null);
        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.description()).isEmpty();
    }
}
