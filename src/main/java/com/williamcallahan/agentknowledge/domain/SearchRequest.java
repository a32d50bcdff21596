package com.williamcallahan.agentknowledge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Client payload for a hybrid search.
 *
 * @param query free-text query
 * @param topK number of results to return; defaults to the configured value when absent
 * @param filters optional constraints
 */
public record SearchRequest(
        @JsonProperty("query") @NotBlank(message = "query must not be blank") String query,
        @JsonProperty("top_k") Integer topK,
        @JsonProperty("filters") SearchFilters filters) {

    public SearchRequest {
        filters = filters == null ? SearchFilters.none() : filters;
    }
}
