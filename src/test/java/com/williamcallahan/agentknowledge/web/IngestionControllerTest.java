package com.williamcallahan.agentknowledge.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.agentknowledge.domain.ingestion.LocalDocsIngestionSummary;
import com.williamcallahan.agentknowledge.service.ingestion.LocalDocsIngestionService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = IngestionController.class)
@Import(ExceptionResponseBuilder.class)
class IngestionControllerTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    LocalDocsIngestionService localDocsIngestionService;

    @Test
    void ingestLocal_usesDefaultsAndCleansTags() throws Exception {
        given(localDocsIngestionService.ingestDirectory(anyString(), isNull(), isNull(), anyList(), anyInt()))
                .willReturn(LocalDocsIngestionSummary.of("docs", 3, 2, 1, List.of()));

        mvc.perform(post("/api/ingest/local").param("tags", " runbook ", "", "ops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.scanned").value(3))
                .andExpect(jsonPath("$.created").value(2))
                .andExpect(jsonPath("$.duplicates").value(1));

        verify(localDocsIngestionService)
                .ingestDirectory(eq("docs"), isNull(), isNull(), eq(List.of("runbook", "ops")), eq(50000));
    }

    @Test
    void ingestLocal_passesProvenanceThrough() throws Exception {
        given(localDocsIngestionService.ingestDirectory(anyString(), anyString(), anyString(), anyList(), anyInt()))
                .willReturn(LocalDocsIngestionSummary.of("/srv/docs", 0, 0, 0, List.of()));

        mvc.perform(post("/api/ingest/local")
                        .param("dir", "/srv/docs")
                        .param("project", "handbook")
                        .param("repo", "acme/docs")
                        .param("maxFiles", "10"))
                .andExpect(status().isOk());

        verify(localDocsIngestionService)
                .ingestDirectory(eq("/srv/docs"), eq("handbook"), eq("acme/docs"), eq(List.of()), eq(10));
    }

    @Test
    void ingestLocal_rejectsNonPositiveMaxFiles() throws Exception {
        mvc.perform(post("/api/ingest/local").param("maxFiles", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("maxFiles must be at least 1"));

        verify(localDocsIngestionService, never()).ingestDirectory(anyString(), any(), any(), anyList(), anyInt());
    }

    @Test
    void ingestLocal_mapsMissingDirectoryToBadRequest() throws Exception {
        given(localDocsIngestionService.ingestDirectory(anyString(), isNull(), isNull(), anyList(), anyInt()))
                .willThrow(new IllegalArgumentException("Local docs directory does not exist: nowhere"));

        mvc.perform(post("/api/ingest/local").param("dir", "nowhere"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Local docs directory does not exist: nowhere"));
    }
}
