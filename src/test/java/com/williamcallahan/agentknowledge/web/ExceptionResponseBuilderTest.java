package com.williamcallahan.agentknowledge.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.agentknowledge.domain.errors.ApiErrorResponse;
import com.williamcallahan.agentknowledge.service.EntryEmbeddingException;
import java.net.ConnectException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies exception descriptions and the error payload shape.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder exceptionResponseBuilder = new ExceptionResponseBuilder();

    @Test
    void describeException_appendsRootCause() {
        IllegalStateException exception =
                new IllegalStateException("embedding failed", new RuntimeException("wrapper", new ConnectException("refused")));

        assertEquals(
                "IllegalStateException: embedding failed (cause: ConnectException: refused)",
                exceptionResponseBuilder.describeException(exception));
    }

    @Test
    void describeException_usesTypeNameWhenMessageMissing() {
        assertEquals("NullPointerException", exceptionResponseBuilder.describeException(new NullPointerException()));
        assertNull(exceptionResponseBuilder.describeException(null));
    }

    @Test
    void buildEntryErrorResponse_carriesEntryId() {
        UUID entryId = UUID.randomUUID();
        EntryEmbeddingException failure = new EntryEmbeddingException(entryId, new ConnectException("refused"));

        ResponseEntity<ApiErrorResponse> response = exceptionResponseBuilder.buildEntryErrorResponse(
                HttpStatus.BAD_GATEWAY, "Entry stored but embedding failed", failure, entryId);

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        ApiErrorResponse body = response.getBody();
        assertEquals("error", body.status());
        assertEquals(entryId.toString(), body.entryId());
        assertEquals("Entry stored but embedding failed", body.message());
    }
}
