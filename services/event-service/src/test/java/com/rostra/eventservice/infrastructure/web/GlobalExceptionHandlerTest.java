package com.rostra.eventservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rostra.eventbus.EventBusClosedException;
import com.rostra.eventbus.InvalidEventException;
import com.rostra.eventmodel.EventSerializer.EventSerializationException;
import com.rostra.eventmodel.EventValidationError;
import com.rostra.eventservice.projection.EntityNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ProblemDetail;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Test
    @DisplayName("maps InvalidEventException to 400 with every validation error")
    @SuppressWarnings("unchecked")
    void mapsInvalidEvent() {
        var ex = new InvalidEventException(List.of(
                new EventValidationError(EventValidationError.Kind.NIL_UUID, "tenant_id", "tenant_id must not be nil"),
                new EventValidationError(EventValidationError.Kind.EMPTY_FIELD, "kind", "kind must not be empty")));

        ProblemDetail result = handler.handleInvalidEvent(ex);

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Invalid Event");
        assertThat(result.getType().toString()).endsWith("/invalid-event");
        var errors = (List<Map<String, String>>) result.getProperties().get("errors");
        assertThat(errors).hasSize(2);
        assertThat(errors.get(0)).containsEntry("kind", "NIL_UUID").containsEntry("field", "tenant_id");
        assertThat(errors.get(1)).containsEntry("field", "kind");
    }

    @Test
    @DisplayName("maps an unreadable event payload to 400")
    void mapsSerializationFailure() {
        ProblemDetail result = handler.handleUnreadableEvent(
                new EventSerializationException("Unknown event type: node.exploded", null));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).contains("node.exploded");
    }

    @Test
    @DisplayName("maps a missing entity to 404")
    void mapsNotFound() {
        UUID id = UUID.randomUUID();
        ProblemDetail result = handler.handleNotFound(new EntityNotFoundException(id));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).contains(id.toString());
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps a closed event bus to 503")
    void mapsClosedBusToUnavailable() {
        ProblemDetail result = handler.handleBusClosed(new EventBusClosedException());

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).isEqualTo("event bus is closed");
    }

    @Test
    @DisplayName("leaves other IllegalStateExceptions to the generic 500 mapping")
    void otherIllegalStateIsInternalError() throws Exception {
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(handler)
                .build();

        mockMvc.perform(get("/closed")).andExpect(status().isServiceUnavailable());
        mockMvc.perform(get("/broken")).andExpect(status().isInternalServerError());
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking the message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("something broke");
    }

    @Test
    @DisplayName("error response includes timestamp and the current correlation ID")
    void errorResponseIncludesTimestampAndCorrelation() {
        MDC.put(CorrelationIdFilter.MDC_KEY, "corr-42");

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-42");
    }

    @RestController
    static class FailingController {

        @GetMapping("/closed")
        String closed() {
            throw new EventBusClosedException();
        }

        @GetMapping("/broken")
        String broken() {
            throw new IllegalStateException("cache not warmed");
        }
    }
}
