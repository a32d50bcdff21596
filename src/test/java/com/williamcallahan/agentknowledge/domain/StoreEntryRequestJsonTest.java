package com.williamcallahan.agentknowledge.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Verifies the snake_case wire format of store requests and outcomes.
 */
class StoreEntryRequestJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsSnakeCaseFieldsAndKindAlias() throws Exception {
        UUID related = UUID.randomUUID();
        String json = """
                {"kind":"bug","title":"Pool exhausted","stack_trace":"at Pool.borrow",
                 "repro_steps":"run load test","root_cause":"leak","idempotency_key":"run-42",
                 "related_ids":["%s"],"metadata":{"project":"billing","commit":"abc123"}}
                """.formatted(related);

        StoreEntryRequest request = objectMapper.readValue(json, StoreEntryRequest.class);

        assertEquals("bug", request.type());
        assertEquals("at Pool.borrow", request.stackTrace());
        assertEquals("run load test", request.reproSteps());
        assertEquals("leak", request.rootCause());
        assertEquals("run-42", request.idempotencyKey());
        assertEquals(List.of(related), request.relatedIds());
        assertEquals("abc123", request.metadata().commit());
        assertEquals(List.of(), request.tags());
    }

    @Test
    void omitsDuplicateOfForCreatedOutcome() throws Exception {
        UUID entryId = UUID.randomUUID();

        String created = objectMapper.writeValueAsString(StoreOutcome.created(entryId));
        String duplicate = objectMapper.writeValueAsString(StoreOutcome.duplicate(entryId));

        assertFalse(created.contains("duplicate_of"));
        assertTrue(duplicate.contains("\"duplicate_of\":\"" + entryId + "\""));
    }
}
