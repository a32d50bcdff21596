package com.williamcallahan.agentknowledge.store;

import java.util.Objects;
import java.util.UUID;

/**
 * Directed relation between two entries. The triple is unique.
 */
public record EntryLink(UUID fromEntryId, UUID toEntryId, String relation) {

    /** Relation used for caller-supplied related ids. */
    public static final String RELATES_TO = "relates_to";

    public EntryLink {
        Objects.requireNonNull(fromEntryId, "fromEntryId");
        Objects.requireNonNull(toEntryId, "toEntryId");
        if (relation == null || relation.isBlank()) {
            throw new IllegalArgumentException("Link relation is required");
        }
    }

    public static EntryLink relatesTo(UUID fromEntryId, UUID toEntryId) {
        return new EntryLink(fromEntryId, toEntryId, RELATES_TO);
    }
}
