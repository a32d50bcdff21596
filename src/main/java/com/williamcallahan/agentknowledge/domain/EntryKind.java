package com.williamcallahan.agentknowledge.domain;

import java.util.Locale;

/**
 * Categorizes a knowledge entry so agents can tell failures, fixes, and reference material apart.
 */
public enum EntryKind {
    /**
     * A recorded failure: error, stack trace, reproduction notes.
     */
    BUG("bug"),

    /**
     * A fix or workaround; solutions are always considered resolved.
     */
    SOLUTION("solution"),

    /**
     * Reference documentation such as ingested markdown files.
     */
    DOC("doc");

    private final String wireName;

    EntryKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lowercase name used on the wire and in the {@code entries.type} column.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name, ignoring case and surrounding whitespace.
     *
     * @param rawKind kind text from a request or database row
     * @return matching kind
     * @throws IllegalArgumentException when the text is blank or not a known kind
     */
    public static EntryKind fromWireName(String rawKind) {
        if (rawKind == null || rawKind.isBlank()) {
            throw new IllegalArgumentException("Entry type is required (one of bug, solution, doc)");
        }
        String normalized = rawKind.trim().toLowerCase(Locale.ROOT);
        for (EntryKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entry type: " + rawKind + " (expected bug, solution, or doc)");
    }
}
