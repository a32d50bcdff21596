package com.williamcallahan.agentknowledge.config;

import java.util.Locale;

/**
 * Character-window chunking settings.
 */
public class ChunkingSettings {

    private static final int CHUNK_SIZE_DEF = 800;
    private static final int OVERLAP_DEF = 100;
    private static final String CHUNK_SIZE_KEY = "app.chunking.chunk-size";
    private static final String OVERLAP_KEY = "app.chunking.overlap";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String OVERLAP_BOUND_MSG = "%s must be less than %s (got %d >= %d).";

    private int chunkSize = CHUNK_SIZE_DEF;
    private int overlap = OVERLAP_DEF;

    public ChunkingSettings() {}

    /**
     * Validates chunk window settings.
     */
    public void validateConfiguration() {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, CHUNK_SIZE_KEY));
        }
        if (overlap < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, OVERLAP_KEY));
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT, OVERLAP_BOUND_MSG, OVERLAP_KEY, CHUNK_SIZE_KEY, overlap, chunkSize));
        }
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(final int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    public void setOverlap(final int overlap) {
        this.overlap = overlap;
    }
}
