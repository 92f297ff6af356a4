package com.rostra.eventservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/events}. {@code data} is the event payload in its wire form and is
 * bound to a concrete event type by {@code event_type}.
 */
public record PublishEventRequest(
        @JsonProperty("tenant_id") @NotNull UUID tenantId,
        @JsonProperty("actor_id") UUID actorId,
        @JsonProperty("event_type") @NotBlank String eventType,
        @JsonProperty("data") @NotNull JsonNode data) {
}
