package com.example.studio.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body shared by the exception handler and the filters.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "FORBIDDEN",
 *   "message": "Access denied",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/api/lessons"
 * }
 * }</pre>
 *
 * @param error         stable error category
 * @param code          specific error code
 * @param message       human-readable message, never internal detail
 * @param correlationId request correlation id
 * @param timestamp     when the error occurred
 * @param path          request path
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path);
    }

    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_ERROR = "authentication_error";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String NOT_FOUND = "not_found";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String UNAUTHORIZED = "UNAUTHORIZED";
        public static final String FORBIDDEN = "FORBIDDEN";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Codes() {
        }
    }
}
