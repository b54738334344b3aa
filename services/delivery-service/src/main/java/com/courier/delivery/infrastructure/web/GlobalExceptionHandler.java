package com.courier.delivery.infrastructure.web;

import com.courier.eventstore.AggregateAlreadyExistsException;
import com.courier.eventstore.AggregateNotFoundException;
import com.courier.eventstore.DomainRuleViolationException;
import com.courier.eventstore.EventStorageException;
import com.courier.eventstore.UnknownEventTypeException;
import com.courier.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://courier.dev/errors/domain-rule-violation",
 *   "title": "Domain Rule Violation",
 *   "status": 422,
 *   "detail": "Not enough budget",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every problem carries the request's correlation ID when one is set.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TYPE_BASE = "https://courier.dev/errors/";

    @ExceptionHandler(DomainRuleViolationException.class)
    public ProblemDetail handleDomainRuleViolation(DomainRuleViolationException ex) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Domain Rule Violation", "domain-rule-violation", ex.reason());
    }

    @ExceptionHandler(AggregateNotFoundException.class)
    public ProblemDetail handleNotFound(AggregateNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(AggregateAlreadyExistsException.class)
    public ProblemDetail handleAlreadyExists(AggregateAlreadyExistsException ex) {
        return problem(HttpStatus.CONFLICT, "Already Exists", "already-exists", ex.getMessage());
    }

    @ExceptionHandler(UnknownEventTypeException.class)
    public ProblemDetail handleUnknownEventType(UnknownEventTypeException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Unknown Event Type", "unknown-event-type", ex.getMessage());
    }

    @ExceptionHandler(EventStorageException.class)
    public ProblemDetail handleStorage(EventStorageException ex) {
        log.error("Event store unavailable", ex);
        return problem(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "storage-unavailable",
                "The event store is unavailable, the command was not applied and may be retried");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        // Spring MVC's own errors (unknown route, wrong method) already know their status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrich(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
