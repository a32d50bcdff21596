package com.williamcallahan.agentknowledge.domain;

import java.util.List;

/**
 * Ranked search results, best first.
 */
public record SearchResponse(List<SearchResult> results) {

    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
