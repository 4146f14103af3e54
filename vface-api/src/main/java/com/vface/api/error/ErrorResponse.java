package com.vface.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every API endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String code, String kind, String message, boolean retryable, Map<String, Object> details) {

    public static ErrorResponse of(String code, String kind, String message, boolean retryable) {
        return new ErrorResponse(code, kind, message, retryable, Map.of());
    }
}
