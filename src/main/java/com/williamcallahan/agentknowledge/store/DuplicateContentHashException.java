package com.williamcallahan.agentknowledge.store;

import java.io.Serial;

/**
 * Raised when an insert loses a race on the content-hash unique index.
 */
public class DuplicateContentHashException extends KnowledgeStoreException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String contentHash;

    public DuplicateContentHashException(String contentHash, Throwable cause) {
        super("An entry with content hash " + contentHash + " already exists", false, cause);
        this.contentHash = contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }
}
