package com.eventhub.rsvp.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for every non-2xx answer. {@code fieldErrors} is only present
 * for request validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message,
                                 Instant.now(), path, List.of());
    }

    public static ErrorResponse invalidRequest(String path, List<FieldError> fieldErrors) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return new ErrorResponse(status.value(), status.getReasonPhrase(), "Validation failed",
                                 Instant.now(), path, fieldErrors);
    }

    public record FieldError(String field, String message) {}
}
