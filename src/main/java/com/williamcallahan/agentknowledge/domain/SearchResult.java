package com.williamcallahan.agentknowledge.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * One ranked hit returned to clients.
 *
 * @param id entry id
 * @param title entry title
 * @param summary first 200 characters of the body, or of the code when the body is empty
 * @param snippet first 400 characters of the body, or of the code when the body is empty
 * @param score fused relevance score, higher is better
 * @param metadata filterable attributes of the entry
 */
public record SearchResult(
        UUID id, String title, String summary, String snippet, double score, SearchResultMetadata metadata) {

    public SearchResult {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metadata, "metadata");
        title = title == null ? "" : title;
        summary = summary == null ? "" : summary;
        snippet = snippet == null ? "" : snippet;
    }
}
