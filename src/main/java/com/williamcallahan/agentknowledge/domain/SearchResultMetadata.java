package com.williamcallahan.agentknowledge.domain;

import java.util.List;

/**
 * Metadata attached to every search hit.
 */
public record SearchResultMetadata(
        String project, String repo, String language, List<String> tags, String severity, boolean resolved) {

    public SearchResultMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
