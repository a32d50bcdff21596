package com.williamcallahan.agentknowledge.service;

import java.io.Serial;

/**
 * Signals that a hybrid search was aborted before fusion.
 *
 * <p>Raised for deadline expiry, interruption, and branch failures that are neither store nor
 * embedding provider errors.</p>
 */
public class HybridSearchException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final boolean timedOut;

    /**
     * Creates a search failure.
     *
     * @param message human-readable summary
     * @param cause branch failure
     * @param timedOut whether the search deadline expired
     */
    public HybridSearchException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
