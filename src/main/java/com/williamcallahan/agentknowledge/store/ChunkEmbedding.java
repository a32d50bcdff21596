package com.williamcallahan.agentknowledge.store;

import java.util.Objects;
import java.util.UUID;

/**
 * One embedded chunk of an entry.
 *
 * @param entryId owning entry
 * @param chunkIndex zero-based position of the chunk within the entry
 * @param chunkText chunk text that was embedded
 * @param vector embedding vector
 */
public record ChunkEmbedding(UUID entryId, int chunkIndex, String chunkText, float[] vector) {

    public ChunkEmbedding {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(chunkText, "chunkText");
        Objects.requireNonNull(vector, "vector");
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("Chunk index must be non-negative");
        }
    }
}
