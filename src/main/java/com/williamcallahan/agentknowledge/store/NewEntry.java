package com.williamcallahan.agentknowledge.store;

import com.williamcallahan.agentknowledge.domain.EntryKind;
import com.williamcallahan.agentknowledge.domain.EntryMetadata;
import com.williamcallahan.agentknowledge.domain.Severity;
import java.util.List;
import java.util.Objects;

/**
 * Entry contents ready for insertion: redacted, fingerprinted, and with blank fields already nulled.
 *
 * @param kind entry kind
 * @param title non-blank title
 * @param body redacted body or null
 * @param stackTrace redacted stack trace or null
 * @param code redacted code or null
 * @param reproSteps redacted reproduction steps or null
 * @param rootCause redacted root cause or null
 * @param resolution redacted resolution or null
 * @param severity severity or null
 * @param tags distinct tags
 * @param metadata provenance metadata
 * @param resolved derived resolution flag
 * @param contentHash fingerprint over the canonical fields
 */
public record NewEntry(
        EntryKind kind,
        String title,
        String body,
        String stackTrace,
        String code,
        String reproSteps,
        String rootCause,
        String resolution,
        Severity severity,
        List<String> tags,
        EntryMetadata metadata,
        boolean resolved,
        String contentHash) {

    public NewEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(contentHash, "contentHash");
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? EntryMetadata.empty() : metadata;
    }
}
