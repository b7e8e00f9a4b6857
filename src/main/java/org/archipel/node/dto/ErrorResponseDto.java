package org.archipel.node.dto;

import java.time.Instant;

/**
 * Error body returned by all node routes.
 *
 * @param timestamp ISO-8601 timestamp when the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message (e.g., "Not Found", "Conflict")
 * @param message   Human-readable error message
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
