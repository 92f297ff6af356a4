package com.rostra.eventservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

public record PublishEventResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("event_type") String eventType) {
}
