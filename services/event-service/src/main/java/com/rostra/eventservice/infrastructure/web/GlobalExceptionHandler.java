package com.rostra.eventservice.infrastructure.web;

import com.rostra.eventbus.EventBusClosedException;
import com.rostra.eventbus.InvalidEventException;
import com.rostra.eventmodel.EventSerializer.EventSerializationException;
import com.rostra.eventmodel.EventValidationError;
import com.rostra.eventservice.projection.EntityNotFoundException;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://rostra.dev/errors/invalid-event",
 *   "title": "Invalid Event",
 *   "status": 400,
 *   "detail": "invalid event: NIL_UUID(tenant_id): tenant_id must not be nil",
 *   "errors": [ { "kind": "NIL_UUID", "field": "tenant_id", "message": "tenant_id must not be nil" } ],
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://rostra.dev/errors/";

    @ExceptionHandler(InvalidEventException.class)
    public ProblemDetail handleInvalidEvent(InvalidEventException ex) {
        log.warn("Rejected event: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Invalid Event", "invalid-event");
        problem.setProperty("errors", describe(ex.errors()));
        return problem;
    }

    @ExceptionHandler(EventSerializationException.class)
    public ProblemDetail handleUnreadableEvent(EventSerializationException ex) {
        log.warn("Unreadable event: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Invalid Event", "invalid-event");
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ProblemDetail handleNotFound(EntityNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "Not Found", "not-found");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request", "Bad Request", "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, detail, "Validation Error", "validation");
    }

    @ExceptionHandler(EventBusClosedException.class)
    public ProblemDetail handleBusClosed(EventBusClosedException ex) {
        log.warn("Unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "Service Unavailable", "unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
                "Internal Server Error", "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }

    private static List<Map<String, String>> describe(List<EventValidationError> errors) {
        return errors.stream().map(error -> {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("kind", error.kind().name());
            entry.put("field", error.field());
            entry.put("message", error.message());
            return entry;
        }).toList();
    }
}
