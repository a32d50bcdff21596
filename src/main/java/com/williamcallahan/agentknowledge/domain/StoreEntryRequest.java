package com.williamcallahan.agentknowledge.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * Client payload for storing a knowledge entry.
 *
 * <p>Kind and severity stay as raw text here; the ingestion service parses them so that
 * unknown values are reported as validation errors instead of deserialization failures.</p>
 *
 * @param type entry kind wire name (bug, solution, doc); {@code kind} is accepted as an alias
 * @param title short non-blank title
 * @param body free-text description
 * @param stackTrace captured stack trace
 * @param code code excerpt
 * @param reproSteps reproduction steps
 * @param rootCause root cause analysis
 * @param resolution how the problem was resolved
 * @param severity optional severity wire name
 * @param tags free-form tags
 * @param metadata provenance metadata
 * @param idempotencyKey caller-supplied key, logged only
 * @param relatedIds entries to link with a {@code relates_to} relation
 */
public record StoreEntryRequest(
        @JsonProperty("type") @JsonAlias("kind") String type,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("stack_trace") String stackTrace,
        @JsonProperty("code") String code,
        @JsonProperty("repro_steps") String reproSteps,
        @JsonProperty("root_cause") String rootCause,
        @JsonProperty("resolution") String resolution,
        @JsonProperty("severity") String severity,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") EntryMetadata metadata,
        @JsonProperty("idempotency_key") String idempotencyKey,
        @JsonProperty("related_ids") List<UUID> relatedIds) {

    public StoreEntryRequest {
        tags = tags == null ? List.of() : List.copyOf(tags.stream().filter(tag -> tag != null).toList());
        metadata = metadata == null ? EntryMetadata.empty() : metadata;
        relatedIds = relatedIds == null
                ? List.of()
                : List.copyOf(relatedIds.stream().filter(id -> id != null).toList());
    }

    /**
     * Starts a builder with only the required fields set.
     */
    public static Builder builder(String type, String title) {
        return new Builder(type, title);
    }

    /**
     * Fluent builder used by ingesters and tests.
     */
    public static final class Builder {
        private final String type;
        private final String title;
        private String body;
        private String stackTrace;
        private String code;
        private String reproSteps;
        private String rootCause;
        private String resolution;
        private String severity;
        private List<String> tags = List.of();
        private EntryMetadata metadata = EntryMetadata.empty();
        private String idempotencyKey;
        private List<UUID> relatedIds = List.of();

        private Builder(String type, String title) {
            this.type = type;
            this.title = title;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            this.stackTrace = stackTrace;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder reproSteps(String reproSteps) {
            this.reproSteps = reproSteps;
            return this;
        }

        public Builder rootCause(String rootCause) {
            this.rootCause = rootCause;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder metadata(EntryMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder relatedIds(List<UUID> relatedIds) {
            this.relatedIds = relatedIds;
            return this;
        }

        public StoreEntryRequest build() {
            return new StoreEntryRequest(
                    type,
                    title,
                    body,
                    stackTrace,
                    code,
                    reproSteps,
                    rootCause,
                    resolution,
                    severity,
                    tags,
                    metadata,
                    idempotencyKey,
                    relatedIds);
        }
    }
}
