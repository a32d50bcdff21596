package com.williamcallahan.agentknowledge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.agentknowledge.config.AppProperties;
import com.williamcallahan.agentknowledge.domain.SearchFilters;
import com.williamcallahan.agentknowledge.domain.SearchResponse;
import com.williamcallahan.agentknowledge.domain.SearchResult;
import com.williamcallahan.agentknowledge.domain.Severity;
import com.williamcallahan.agentknowledge.store.CandidateRow;
import com.williamcallahan.agentknowledge.store.EntryFilter;
import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies hybrid search fan-out, fusion, result shaping, and failure propagation.
 */
class HybridSearchServiceTest {
    private static final String QUERY = "connection refused";
    private static final float[] QUERY_VECTOR = {1.0f, 0.0f};

    private KnowledgeStore knowledgeStore;
    private EmbeddingClient embeddingClient;
    private AppProperties appProperties;
    private ExecutorService searchExecutor;
    private HybridSearchService searchService;

    @BeforeEach
    void setUp() {
        knowledgeStore = mock(KnowledgeStore.class);
        embeddingClient = mock(EmbeddingClient.class);
        appProperties = new AppProperties();
        searchExecutor = Executors.newFixedThreadPool(4);
        searchService = new HybridSearchService(knowledgeStore, embeddingClient, appProperties, searchExecutor);
        when(embeddingClient.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    }

    @AfterEach
    void tearDown() {
        searchExecutor.shutdownNow();
    }

    private static CandidateRow row(UUID id, String title, String body, String code, double nativeScore) {
        return new CandidateRow(id, title, body, code, "proj", "repo", "java", List.of("db"), "high", true, nativeScore);
    }

    @Test
    void fusesBothRankingsAndTruncatesToTopK() {
        UUID lexicalOnly = UUID.randomUUID();
        UUID shared = UUID.randomUUID();
        UUID vectorOnly = UUID.randomUUID();
        when(knowledgeStore.lexicalSearch(eq(QUERY), any(EntryFilter.class), anyInt()))
                .thenReturn(List.of(row(lexicalOnly, "A", "a", null, 0.5), row(shared, "B", "b", null, 0.4)));
        when(knowledgeStore.vectorSearch(eq(QUERY_VECTOR), any(EntryFilter.class), anyInt()))
                .thenReturn(List.of(row(shared, "B", "b", null, 1.2), row(vectorOnly, "C", "c", null, 1.1)));

        SearchResponse response = searchService.search(QUERY, SearchFilters.none(), 2);

        assertEquals(List.of(shared, vectorOnly), response.results().stream().map(SearchResult::id).toList());
        assertEquals(0.4 + 1.0 / 62 + 1.2 + 1.0 / 61, response.results().get(0).score(), 1e-9);
    }

    @Test
    void shapesSummarySnippetAndMetadata() {
        UUID id = UUID.randomUUID();
        String body = "b".repeat(500);
        when(knowledgeStore.lexicalSearch(eq(QUERY), any(EntryFilter.class), anyInt()))
                .thenReturn(List.of(row(id, "Title", body, "code", 0.3)));
        when(knowledgeStore.vectorSearch(eq(QUERY_VECTOR), any(EntryFilter.class), anyInt())).thenReturn(List.of());

        SearchResult result = searchService.search(QUERY, null, null).results().get(0);

        assertEquals("Title", result.title());
        assertEquals(200, result.summary().length());
        assertEquals(400, result.snippet().length());
        assertEquals("proj", result.metadata().project());
        assertEquals("repo", result.metadata().repo());
        assertEquals("java", result.metadata().language());
        assertEquals(List.of("db"), result.metadata().tags());
        assertEquals("high", result.metadata().severity());
        assertTrue(result.metadata().resolved());
    }

    @Test
    void previewFallsBackToCodeWhenBodyIsEmpty() {
        UUID id = UUID.randomUUID();
        when(knowledgeStore.lexicalSearch(eq(QUERY), any(EntryFilter.class), anyInt()))
                .thenReturn(List.of(row(id, "Title", null, "int x = 1;", 0.3)));
        when(knowledgeStore.vectorSearch(eq(QUERY_VECTOR), any(EntryFilter.class), anyInt())).thenReturn(List.of());

        SearchResult result = searchService.search(QUERY, null, 5).results().get(0);

        assertEquals("int x = 1;", result.summary());
        assertEquals("int x = 1;", result.snippet());
    }

    @Test
    void fetchesAtLeastCandidateFloorFromEachList() {
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenReturn(List.of());
        when(knowledgeStore.vectorSearch(any(float[].class), any(EntryFilter.class), anyInt())).thenReturn(List.of());

        searchService.search(QUERY, null, 5);
        searchService.search(QUERY, null, 30);

        verify(knowledgeStore).lexicalSearch(eq(QUERY), any(EntryFilter.class), eq(20));
        verify(knowledgeStore).vectorSearch(eq(QUERY_VECTOR), any(EntryFilter.class), eq(20));
        verify(knowledgeStore).lexicalSearch(eq(QUERY), any(EntryFilter.class), eq(30));
        verify(knowledgeStore).vectorSearch(eq(QUERY_VECTOR), any(EntryFilter.class), eq(30));
    }

    @Test
    void passesSameParsedFilterToBothQueries() {
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenReturn(List.of());
        when(knowledgeStore.vectorSearch(any(float[].class), any(EntryFilter.class), anyInt())).thenReturn(List.of());
        SearchFilters filters =
                new SearchFilters("proj", null, "java", "high", true, "2024-01-01T00:00:00Z", List.of("db"));

        searchService.search(QUERY, filters, 10);

        verify(knowledgeStore).lexicalSearch(eq(QUERY), argThat(HybridSearchServiceTest::isExpectedFilter), eq(20));
        verify(knowledgeStore).vectorSearch(eq(QUERY_VECTOR), argThat(HybridSearchServiceTest::isExpectedFilter), eq(20));
    }

    private static boolean isExpectedFilter(EntryFilter filter) {
        return "proj".equals(filter.project())
                && "java".equals(filter.language())
                && filter.severity() == Severity.HIGH
                && Boolean.TRUE.equals(filter.resolved())
                && filter.since() != null
                && filter.tags().equals(List.of("db"));
    }

    @Test
    void rejectsOutOfRangeTopKAndBlankQuery() {
        assertThrows(IllegalArgumentException.class, () -> searchService.search(QUERY, null, 0));
        assertThrows(IllegalArgumentException.class, () -> searchService.search(QUERY, null, 51));
        assertThrows(IllegalArgumentException.class, () -> searchService.search("  ", null, 5));

        verifyNoInteractions(knowledgeStore);
    }

    @Test
    void lexicalFailureAbortsSearchAndSkipsVectorQuery() {
        CountDownLatch embeddingRelease = new CountDownLatch(1);
        KnowledgeStoreException storeFailure = new KnowledgeStoreException("lexical query failed", false);
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenThrow(storeFailure);
        when(embeddingClient.embedQuery(QUERY)).thenAnswer(invocation -> {
            embeddingRelease.await(5, TimeUnit.SECONDS);
            return QUERY_VECTOR;
        });

        KnowledgeStoreException thrown =
                assertThrows(KnowledgeStoreException.class, () -> searchService.search(QUERY, null, 5));
        embeddingRelease.countDown();

        assertSame(storeFailure, thrown);
        verify(knowledgeStore, after(300).never()).vectorSearch(any(float[].class), any(EntryFilter.class), anyInt());
    }

    @Test
    void embeddingFailurePropagatesUnchanged() {
        EmbeddingServiceUnavailableException embeddingFailure = new EmbeddingServiceUnavailableException("provider down");
        when(embeddingClient.embedQuery(QUERY)).thenThrow(embeddingFailure);
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenReturn(List.of());

        EmbeddingServiceUnavailableException thrown =
                assertThrows(EmbeddingServiceUnavailableException.class, () -> searchService.search(QUERY, null, 5));

        assertSame(embeddingFailure, thrown);
        verify(knowledgeStore, never()).vectorSearch(any(float[].class), any(EntryFilter.class), anyInt());
    }

    @Test
    void unexpectedBranchFailureIsWrapped() {
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenReturn(List.of());
        when(knowledgeStore.vectorSearch(any(float[].class), any(EntryFilter.class), anyInt()))
                .thenThrow(new IllegalStateException("unexpected"));

        HybridSearchException thrown = assertThrows(HybridSearchException.class, () -> searchService.search(QUERY, null, 5));

        assertTrue(thrown.getCause() instanceof IllegalStateException);
        assertTrue(!thrown.isTimedOut());
    }

    @Test
    void deadlineExpiryFailsSearch() {
        appProperties.getSearch().setQueryTimeout(Duration.ofMillis(200));
        CountDownLatch lexicalRelease = new CountDownLatch(1);
        when(knowledgeStore.lexicalSearch(anyString(), any(EntryFilter.class), anyInt())).thenAnswer(invocation -> {
            lexicalRelease.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        when(knowledgeStore.vectorSearch(any(float[].class), any(EntryFilter.class), anyInt())).thenReturn(List.of());

        try {
            HybridSearchException thrown =
                    assertThrows(HybridSearchException.class, () -> searchService.search(QUERY, null, 5));
            assertTrue(thrown.isTimedOut());
        } finally {
            lexicalRelease.countDown();
        }
    }
}
