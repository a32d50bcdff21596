package com.williamcallahan.agentknowledge.service;

import java.util.List;

/**
 * Turns chunk text and search queries into dense vectors.
 *
 * <p>Implementations answer with exactly one vector per input in input order, or throw
 * {@link EmbeddingServiceUnavailableException}. Placeholder vectors are never substituted.</p>
 */
public interface EmbeddingClient {

    /**
     * Embeds a batch of chunk texts.
     *
     * @param texts inputs, possibly empty
     * @return one vector per input
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single search query; null is embedded as empty text.
     */
    default float[] embedQuery(String query) {
        List<float[]> vectors = embed(List.of(query == null ? "" : query));
        if (vectors.size() != 1) {
            throw new EmbeddingServiceUnavailableException(
                    "Expected one vector for the search query, got " + vectors.size());
        }
        return vectors.get(0);
    }
}
