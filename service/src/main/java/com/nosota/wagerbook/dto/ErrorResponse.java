package com.nosota.wagerbook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by GlobalExceptionHandler.
 *
 * @param code      stable machine-readable code, e.g. BETTING_CLOSED
 * @param retryable true when the same request may succeed if repeated
 * @param details   extra context (existing status, balance), omitted when empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String code,
        String message,
        String path,
        boolean retryable,
        Map<String, Object> details
) {
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, code, message, path, false, Map.of());
    }

    public static ErrorResponse of(int status, String error, String code, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status, error, code, message, path, false, details);
    }

    public static ErrorResponse retryable(int status, String error, String code, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, code, message, path, true, Map.of());
    }
}
