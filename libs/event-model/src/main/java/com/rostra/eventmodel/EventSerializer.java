package com.rostra.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON serialization and deserialization for {@link EventEnvelope}.
 *
 * <p>Wire shape, stable for consumers outside this codebase:
 *
 * <pre>
 * {
 *   "id": "9f0c…",
 *   "tenant_id": "3a1e…",
 *   "actor_id": null,
 *   "event_type": "node.created",
 *   "occurred_at": "2026-03-01T10:15:30.123Z",
 *   "data": { "node_id": "…", "kind": "post", "author_id": null }
 * }
 * </pre>
 *
 * <p>The {@code JavaTimeModule} handles {@code Instant} ↔ ISO 8601 conversion. Money amounts
 * are required: a missing or null {@code price}, {@code total} or {@code amount} is rejected rather
 * than read as zero.
 */
public final class EventSerializer {

    public static final String FIELD_ID = "id";
    public static final String FIELD_TENANT_ID = "tenant_id";
    public static final String FIELD_ACTOR_ID = "actor_id";
    public static final String FIELD_EVENT_TYPE = "event_type";
    public static final String FIELD_OCCURRED_AT = "occurred_at";
    public static final String FIELD_DATA = "data";

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Serializes an envelope to its JSON object form.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static ObjectNode toTree(EventEnvelope envelope) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(FIELD_ID, envelope.id().toString());
        root.put(FIELD_TENANT_ID, envelope.tenantId().toString());
        if (envelope.actorId() != null) {
            root.put(FIELD_ACTOR_ID, envelope.actorId().toString());
        } else {
            root.putNull(FIELD_ACTOR_ID);
        }
        root.put(FIELD_EVENT_TYPE, envelope.eventType().value());
        root.set(FIELD_OCCURRED_AT, MAPPER.valueToTree(envelope.occurredAt()));
        try {
            root.set(FIELD_DATA, MAPPER.valueToTree(envelope.event()));
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize event: " + envelope.id(), e);
        }
        return root;
    }

    /**
     * Serializes an envelope to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(EventEnvelope envelope) {
        try {
            return MAPPER.writeValueAsString(toTree(envelope));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + envelope.id(), e);
        }
    }

    /**
     * Deserializes a JSON string to an envelope. The {@code event_type} tag selects the variant.
     *
     * @throws EventSerializationException if the JSON is malformed, a required field is missing or
     *     the event type is unknown
     */
    public static EventEnvelope deserialize(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventSerializationException("Event JSON must be an object", null);
        }
        UUID id = uuid(root, FIELD_ID);
        UUID tenantId = uuid(root, FIELD_TENANT_ID);
        JsonNode actor = root.get(FIELD_ACTOR_ID);
        UUID actorId = actor == null || actor.isNull() ? null : parseUuid(FIELD_ACTOR_ID, actor.asText());
        Instant occurredAt = convert(required(root, FIELD_OCCURRED_AT), Instant.class);
        DomainEvent event = readEvent(required(root, FIELD_EVENT_TYPE).asText(), required(root, FIELD_DATA));
        return new EventEnvelope(id, tenantId, actorId, occurredAt, event);
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<EventEnvelope> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /**
     * Builds a domain event from its type tag and {@code data} object.
     *
     * @throws EventSerializationException if the type is unknown or the data does not fit it
     */
    public static DomainEvent readEvent(String eventType, JsonNode data) {
        EventType type = EventType.fromString(eventType)
                .orElseThrow(() -> new EventSerializationException("Unknown event type: " + eventType, null));
        if (data == null || !data.isObject()) {
            throw new EventSerializationException("Event data for " + eventType + " must be an object", null);
        }
        return convert(data, type.payloadType());
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to read " + type.getSimpleName(), e);
        }
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new EventSerializationException("Missing required field: " + field, null);
        }
        return node;
    }

    private static UUID uuid(JsonNode root, String field) {
        return parseUuid(field, required(root, field).asText());
    }

    private static UUID parseUuid(String field, String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Field " + field + " is not a UUID: " + value, e);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
