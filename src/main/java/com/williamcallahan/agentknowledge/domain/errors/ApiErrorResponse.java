package com.williamcallahan.agentknowledge.domain.errors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Describes a standard JSON error payload that API clients can interpret uniformly.
 *
 * @param status fixed status indicator ("error")
 * @param message user-facing error message
 * @param details optional diagnostic details
 * @param entryId id of an entry that was persisted before the failure, when one exists
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String status, String message, String details, @JsonProperty("entry_id") String entryId) {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details, null);
    }

    /**
     * Creates an error payload that also reports a partially persisted entry.
     */
    public static ApiErrorResponse errorForEntry(String message, String details, String entryId) {
        return new ApiErrorResponse(STATUS_ERROR, message, details, entryId);
    }
}
