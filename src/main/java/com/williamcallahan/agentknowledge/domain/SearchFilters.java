package com.williamcallahan.agentknowledge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Optional search constraints as supplied by clients. All present fields must match.
 *
 * @param project exact project match
 * @param repo exact repository match
 * @param language exact language match
 * @param severity severity wire name
 * @param resolved resolution state
 * @param since ISO-8601 instant; entries created at or after it match
 * @param tags matches entries sharing at least one tag
 */
public record SearchFilters(
        @JsonProperty("project") String project,
        @JsonProperty("repo") String repo,
        @JsonProperty("language") String language,
        @JsonProperty("severity") String severity,
        @JsonProperty("resolved") Boolean resolved,
        @JsonProperty("since") String since,
        @JsonProperty("tags") List<String> tags) {

    public SearchFilters {
        tags = tags == null ? List.of() : List.copyOf(tags.stream().filter(tag -> tag != null).toList());
    }

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null, null, null, List.of());
    }
}
