package com.williamcallahan.agentknowledge.store;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates an {@link EntryFilter} into a parameterized SQL predicate over the {@code entries} table.
 *
 * <p>Both the lexical and vector queries use the same predicate so their candidate sets agree.</p>
 */
final class EntryFilterSqlBuilder {

    private EntryFilterSqlBuilder() {}

    /**
     * SQL conditions joined with {@code and} plus their bind values in order.
     *
     * @param conditions conditions without a leading keyword; empty when unconstrained
     * @param parameters positional bind values
     */
    record SqlPredicate(String conditions, List<Object> parameters) {
        SqlPredicate {
            Objects.requireNonNull(conditions, "conditions");
            parameters = List.copyOf(parameters);
        }

        boolean isEmpty() {
            return conditions.isEmpty();
        }

        /**
         * Renders the predicate as a trailing {@code and ...} fragment, or an empty string.
         */
        String asAndClause() {
            return isEmpty() ? "" : " and " + conditions;
        }
    }

    /**
     * Builds the predicate.
     *
     * @param filter constraints to translate
     * @param entryAlias table alias of {@code entries} in the surrounding query
     * @return predicate and parameters
     */
    static SqlPredicate build(EntryFilter filter, String entryAlias) {
        Objects.requireNonNull(filter, "filter");
        String column = entryAlias == null || entryAlias.isBlank() ? "" : entryAlias + ".";
        List<String> conditions = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();

        if (filter.project() != null) {
            conditions.add(column + "project = ?");
            parameters.add(filter.project());
        }
        if (filter.repo() != null) {
            conditions.add(column + "repo = ?");
            parameters.add(filter.repo());
        }
        if (filter.language() != null) {
            conditions.add(column + "language = ?");
            parameters.add(filter.language());
        }
        if (filter.severity() != null) {
            conditions.add(column + "severity = ?");
            parameters.add(filter.severity().wireName());
        }
        if (filter.resolved() != null) {
            conditions.add(column + "resolved = ?");
            parameters.add(filter.resolved());
        }
        if (filter.since() != null) {
            conditions.add(column + "created_at >= ?");
            parameters.add(Timestamp.from(filter.since()));
        }
        if (!filter.tags().isEmpty()) {
            conditions.add(column + "tags && ?::text[]");
            parameters.add(filter.tags().toArray(new String[0]));
        }
        return new SqlPredicate(String.join(" and ", conditions), parameters);
    }
}
