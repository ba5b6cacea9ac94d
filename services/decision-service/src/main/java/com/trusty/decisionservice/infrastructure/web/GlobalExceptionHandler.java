package com.trusty.decisionservice.infrastructure.web;

import com.trusty.accesscontrol.InvalidRequestException;
import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.directory.DirectoryConflictException;
import com.trusty.directory.DirectoryEntityNotFoundException;
import com.trusty.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://trusty.dev/errors/invalid-request",
 *   "title": "Invalid Request",
 *   "status": 400,
 *   "detail": "Invalid request: external_user_id must not be null or blank",
 *   "errors": ["external_user_id must not be null or blank"],
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>WHY 503 for an unreachable store: the caller asked a question nobody could answer. Reporting
 * it as a denial would look like a policy decision; reporting it as 500 would hide that retrying
 * later is the right move.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://trusty.dev/errors/";

    @ExceptionHandler(InvalidRequestException.class)
    public ProblemDetail handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Invalid request: {}", ex.errors());
        ProblemDetail problem =
                problem(HttpStatus.BAD_REQUEST, "Invalid Request", "invalid-request", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                "bad-request",
                "Request body is missing or is not valid JSON");
    }

    @ExceptionHandler(DirectoryEntityNotFoundException.class)
    public ProblemDetail handleNotFound(DirectoryEntityNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return problem(
                HttpStatus.NOT_FOUND,
                "Not Found",
                "not-found",
                "No endpoint " + ex.getHttpMethod() + " /" + ex.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return problem(
                HttpStatus.METHOD_NOT_ALLOWED,
                "Method Not Allowed",
                "method-not-allowed",
                ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ProblemDetail handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        return problem(
                HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported Media Type",
                "unsupported-media-type",
                ex.getMessage());
    }

    @ExceptionHandler(DirectoryConflictException.class)
    public ProblemDetail handleConflict(DirectoryConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ProblemDetail handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Directory store unavailable: {}", ex.getMessage());
        return problem(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service Unavailable",
                "store-unavailable",
                "The directory store is unavailable; no decision was made");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds timestamp and correlation ID so a response can be matched to its log lines. */
    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
