package com.williamcallahan.agentknowledge.store;

import com.williamcallahan.agentknowledge.domain.SearchFilters;
import com.williamcallahan.agentknowledge.domain.Severity;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Conjunction of entry constraints shared by the lexical and vector queries.
 *
 * <p>Null or empty components are unconstrained.</p>
 *
 * @param project exact project
 * @param repo exact repository
 * @param language exact language
 * @param severity exact severity
 * @param resolved exact resolution flag
 * @param since inclusive lower bound on creation time
 * @param tags entries must share at least one of these tags
 */
public record EntryFilter(
        String project,
        String repo,
        String language,
        Severity severity,
        Boolean resolved,
        Instant since,
        List<String> tags) {

    public EntryFilter {
        project = blankToNull(project);
        repo = blankToNull(repo);
        language = blankToNull(language);
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .toList()));
    }

    /**
     * Returns a filter with no constraints.
     */
    public static EntryFilter none() {
        return new EntryFilter(null, null, null, null, null, null, List.of());
    }

    /**
     * Parses client filters.
     *
     * @param filters client filters, may be null
     * @return parsed filter
     * @throws IllegalArgumentException for an unknown severity or an unparseable {@code since}
     */
    public static EntryFilter from(SearchFilters filters) {
        if (filters == null) {
            return none();
        }
        return new EntryFilter(
                filters.project(),
                filters.repo(),
                filters.language(),
                Severity.parseOptional(filters.severity()).orElse(null),
                filters.resolved(),
                parseSince(filters.since()),
                filters.tags());
    }

    private static Instant parseSince(String rawSince) {
        if (rawSince == null || rawSince.isBlank()) {
            return null;
        }
        String trimmed = rawSince.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException instantFailure) {
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException offsetFailure) {
                throw new IllegalArgumentException(
                        "filters.since must be an ISO-8601 timestamp (got " + rawSince + ")", offsetFailure);
            }
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
