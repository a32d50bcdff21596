package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.support.LexicalTokenizer;
import java.util.ArrayList;
import java.util.List;

/**
 * CPU-only deterministic embedding based on token feature hashing.
 *
 * <p>Each lexical token adds a signed unit to one bucket chosen by its murmur3 hash, so texts
 * sharing vocabulary land close together. Not semantically strong; intended for offline runs and tests.</p>
 */
public class HashingEmbeddingClient implements EmbeddingClient {
    private final int dimensions;

    public HashingEmbeddingClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(hashToVector(text));
        }
        return List.copyOf(vectors);
    }

    private float[] hashToVector(String text) {
        float[] vector = new float[dimensions];
        for (String token : LexicalTokenizer.tokenize(text)) {
            int hash = LexicalTokenizer.murmurHash32(token);
            int bucket = Math.floorMod(hash, dimensions);
            // top bit picks the sign
            vector[bucket] += (hash & 0x8000_0000) == 0 ? 1.0f : -1.0f;
        }
        return vector;
    }
}
