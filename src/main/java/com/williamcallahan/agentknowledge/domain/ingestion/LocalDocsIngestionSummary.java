package com.williamcallahan.agentknowledge.domain.ingestion;

import java.util.List;
import java.util.Objects;

/**
 * Totals for one local documentation ingestion run.
 *
 * @param status "success" when every file was stored or deduplicated, otherwise "partial-success"
 * @param dir ingested directory path
 * @param scanned number of eligible files visited
 * @param created number of new entries
 * @param duplicates number of files whose content already existed
 * @param failures per-file failures
 */
public record LocalDocsIngestionSummary(
        String status, String dir, int scanned, int created, int duplicates, List<LocalDocsIngestionFailure> failures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public LocalDocsIngestionSummary {
        Objects.requireNonNull(status, "Status is required");
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("Ingested directory is required");
        }
        if (scanned < 0 || created < 0 || duplicates < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Builds a summary, deriving the status from the presence of failures.
     */
    public static LocalDocsIngestionSummary of(
            String dir, int scanned, int created, int duplicates, List<LocalDocsIngestionFailure> failures) {
        boolean hasFailures = failures != null && !failures.isEmpty();
        String status = hasFailures ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new LocalDocsIngestionSummary(status, dir, scanned, created, duplicates, failures);
    }
}
