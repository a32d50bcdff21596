package com.williamcallahan.agentknowledge.service;

/**
 * Raised when a call produced no usable vectors: the provider refused or could not be reached, or
 * its answer cannot be stored.
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    private final boolean retryable;

    public EmbeddingServiceUnavailableException(String message) {
        this(message, false, null);
    }

    /**
     * @param message what went wrong, safe to return to API callers
     * @param retryable whether sending the same inputs again may succeed
     * @param cause provider or SDK failure, may be null
     */
    public EmbeddingServiceUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
