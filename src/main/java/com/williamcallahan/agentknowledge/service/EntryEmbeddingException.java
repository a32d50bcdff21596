package com.williamcallahan.agentknowledge.service;

import java.io.Serial;
import java.util.Objects;
import java.util.UUID;

/**
 * Raised when an entry was persisted but its chunk embeddings could not be generated or stored.
 *
 * <p>The entry and its links remain in place; callers can report the id back to the client.</p>
 */
public class EntryEmbeddingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final UUID entryId;

    public EntryEmbeddingException(UUID entryId, Throwable cause) {
        super("Entry " + entryId + " was stored but embedding failed: "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.entryId = Objects.requireNonNull(entryId, "entryId");
    }

    public UUID getEntryId() {
        return entryId;
    }
}
