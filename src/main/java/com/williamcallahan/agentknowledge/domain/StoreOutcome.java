package com.williamcallahan.agentknowledge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.UUID;

/**
 * Result of a store call.
 *
 * @param id id of the created or pre-existing entry
 * @param created true when a new entry was persisted
 * @param duplicateOf id of the existing entry when the content hash already existed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreOutcome(
        @JsonProperty("id") UUID id,
        @JsonProperty("created") boolean created,
        @JsonProperty("duplicate_of") UUID duplicateOf) {

    public StoreOutcome {
        Objects.requireNonNull(id, "id");
        if (created && duplicateOf != null) {
            throw new IllegalArgumentException("A created entry cannot be a duplicate");
        }
    }

    public static StoreOutcome created(UUID id) {
        return new StoreOutcome(id, true, null);
    }

    public static StoreOutcome duplicate(UUID existingId) {
        return new StoreOutcome(existingId, false, existingId);
    }
}
