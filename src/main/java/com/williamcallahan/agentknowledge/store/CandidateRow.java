package com.williamcallahan.agentknowledge.store;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry row returned by a ranked store query, carrying the backend's native score.
 *
 * @param entryId entry id
 * @param title entry title
 * @param body entry body or null
 * @param code entry code or null
 * @param project project or null
 * @param repo repository or null
 * @param language language or null
 * @param tags entry tags
 * @param severity severity wire name or null
 * @param resolved resolution flag
 * @param nativeScore text rank for lexical rows, similarity for vector rows
 */
public record CandidateRow(
        UUID entryId,
        String title,
        String body,
        String code,
        String project,
        String repo,
        String language,
        List<String> tags,
        String severity,
        boolean resolved,
        double nativeScore) {

    public CandidateRow {
        Objects.requireNonNull(entryId, "entryId");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
