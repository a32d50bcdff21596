package com.williamcallahan.agentknowledge.web;

import com.williamcallahan.agentknowledge.domain.errors.ApiErrorResponse;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds an error response for a failure that happened after an entry was persisted.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @param entryId id of the persisted entry
     * @return ResponseEntity with error details and the entry id
     */
    public ResponseEntity<ApiErrorResponse> buildEntryErrorResponse(
            HttpStatus status, String message, Exception exception, UUID entryId) {
        return ResponseEntity.status(status)
                .body(ApiErrorResponse.errorForEntry(
                        message, describeException(exception), entryId == null ? null : entryId.toString()));
    }

    /**
     * Describes an exception and its root cause for diagnostics.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(describeThrowable(exception));
        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            details.append(" (cause: ").append(describeThrowable(rootCause)).append(')');
        }
        return details.toString();
    }

    private static String describeThrowable(Throwable throwable) {
        String message = throwable.getMessage();
        String typeName = throwable.getClass().getSimpleName();
        return message == null || message.isBlank() ? typeName : typeName + ": " + message;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
