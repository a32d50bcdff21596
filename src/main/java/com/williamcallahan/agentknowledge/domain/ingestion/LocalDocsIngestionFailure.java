package com.williamcallahan.agentknowledge.domain.ingestion;

import java.util.Objects;

/**
 * A documentation file that could not be stored, with the step that failed.
 *
 * @param filePath file path as walked
 * @param phase failing step ("read" or "store")
 * @param details failure details for diagnostics
 */
public record LocalDocsIngestionFailure(String filePath, String phase, String details) {

    public LocalDocsIngestionFailure {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
