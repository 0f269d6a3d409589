package com.bybot.backend.dto;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint of the control plane.
 */
public record ApiError(
        Instant timestamp,
        String path,
        int status,
        String error,
        String message,
        List<FieldIssue> details
) {

    public record FieldIssue(String field, String issue) {}

    public static ApiError of(HttpStatus status, String message, String path, List<FieldIssue> details) {
        return new ApiError(Instant.now(), path, status.value(), status.getReasonPhrase(), message,
                details == null ? List.of() : List.copyOf(details));
    }
}
