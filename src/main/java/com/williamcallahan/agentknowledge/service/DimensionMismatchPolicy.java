package com.williamcallahan.agentknowledge.service;

/**
 * What to do when the provider returns a vector shorter than the configured dimension.
 *
 * <p>Longer vectors are always truncated to the configured dimension.</p>
 */
public enum DimensionMismatchPolicy {
    /**
     * Fail the embedding call with {@link EmbeddingServiceUnavailableException}.
     */
    REJECT,

    /**
     * Keep the shorter vector as returned.
     */
    ACCEPT
}
