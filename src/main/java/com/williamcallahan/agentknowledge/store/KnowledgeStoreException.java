package com.williamcallahan.agentknowledge.store;

import java.io.Serial;

/**
 * Raised when the knowledge store backend fails.
 *
 * <p>The transient flag tells callers whether retrying the same operation may succeed.</p>
 */
public class KnowledgeStoreException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public KnowledgeStoreException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public KnowledgeStoreException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Reports whether the failure was caused by a temporary backend condition.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
