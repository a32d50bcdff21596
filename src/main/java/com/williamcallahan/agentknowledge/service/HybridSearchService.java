package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.config.AppProperties;
import com.williamcallahan.agentknowledge.config.SearchSettings;
import com.williamcallahan.agentknowledge.domain.SearchFilters;
import com.williamcallahan.agentknowledge.domain.SearchRequest;
import com.williamcallahan.agentknowledge.domain.SearchResponse;
import com.williamcallahan.agentknowledge.domain.SearchResult;
import com.williamcallahan.agentknowledge.domain.SearchResultMetadata;
import com.williamcallahan.agentknowledge.store.CandidateRow;
import com.williamcallahan.agentknowledge.store.EntryFilter;
import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Executes hybrid (lexical + vector) search over stored entries using reciprocal rank fusion.
 *
 * <p>The lexical query and the query embedding run in parallel on the search executor; the vector
 * query starts as soon as the embedding is available. All branches are joined under one deadline.
 * The first branch failure cancels the others and aborts the search, so callers never receive a
 * ranking built from a partial candidate set.</p>
 */
@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    static final int SUMMARY_LENGTH = 200;
    static final int SNIPPET_LENGTH = 400;

    private final KnowledgeStore knowledgeStore;
    private final EmbeddingClient embeddingClient;
    private final SearchSettings searchSettings;
    private final ExecutorService searchExecutor;

    /**
     * Wires the store, embedding client, and fan-out executor.
     *
     * @param knowledgeStore store answering the ranked queries
     * @param embeddingClient client embedding the query text
     * @param appProperties application configuration
     * @param searchExecutor executor running the search branches
     */
    public HybridSearchService(
            KnowledgeStore knowledgeStore,
            EmbeddingClient embeddingClient,
            AppProperties appProperties,
            @Qualifier("searchExecutor") ExecutorService searchExecutor) {
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.searchSettings = Objects.requireNonNull(appProperties, "appProperties").getSearch();
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
    }

    /**
     * Searches using a client request.
     *
     * @param request query, optional top_k and optional filters
     * @return ranked results
     */
    public SearchResponse search(SearchRequest request) {
        Objects.requireNonNull(request, "request");
        return search(request.query(), request.filters(), request.topK());
    }

    /**
     * Searches entries matching the filters.
     *
     * @param query free-text query
     * @param filters optional constraints
     * @param requestedTopK number of results, or null for the configured default
     * @return at most {@code topK} results, highest fused score first
     * @throws IllegalArgumentException for a blank query, an out-of-range top_k, or invalid filters
     * @throws HybridSearchException when the deadline expires or a branch fails unexpectedly
     */
    public SearchResponse search(String query, SearchFilters filters, Integer requestedTopK) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        int topK = resolveTopK(requestedTopK);
        EntryFilter entryFilter = EntryFilter.from(filters);
        int candidateLimit = Math.max(topK, searchSettings.getCandidateFloor());

        CompletableFuture<List<CandidateRow>> lexicalBranch = CompletableFuture.supplyAsync(
                () -> knowledgeStore.lexicalSearch(query, entryFilter, candidateLimit), searchExecutor);
        CompletableFuture<float[]> embeddingBranch =
                CompletableFuture.supplyAsync(() -> embeddingClient.embedQuery(query), searchExecutor);
        CompletableFuture<List<CandidateRow>> vectorBranch = embeddingBranch.thenApplyAsync(
                queryVector -> knowledgeStore.vectorSearch(queryVector, entryFilter, candidateLimit), searchExecutor);

        awaitBranches(List.of(lexicalBranch, embeddingBranch, vectorBranch), searchSettings.getQueryTimeout());

        List<CandidateRow> lexicalRows = lexicalBranch.join();
        List<CandidateRow> vectorRows = vectorBranch.join();
        List<SearchResult> results = ReciprocalRankFusion.fuse(List.of(lexicalRows, vectorRows), searchSettings.getRrfK())
                .stream()
                .limit(topK)
                .map(HybridSearchService::toSearchResult)
                .toList();
        log.info(
                "[SEARCH] Returned {} result(s) (lexical={}, vector={}, topK={})",
                results.size(),
                lexicalRows.size(),
                vectorRows.size(),
                topK);
        return new SearchResponse(results);
    }

    private int resolveTopK(Integer requestedTopK) {
        int topK = requestedTopK == null ? searchSettings.getDefaultTopK() : requestedTopK;
        if (topK < 1 || topK > searchSettings.getMaxTopK()) {
            throw new IllegalArgumentException(
                    "top_k must be between 1 and " + searchSettings.getMaxTopK() + " (got " + topK + ")");
        }
        return topK;
    }

    private static void awaitBranches(List<CompletableFuture<?>> branches, Duration timeout) {
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        for (CompletableFuture<?> branch : branches) {
            branch.whenComplete((ignored, failure) -> {
                if (failure == null) {
                    return;
                }
                Throwable cause = unwrap(failure);
                if (!(cause instanceof CancellationException) && firstFailure.compareAndSet(null, cause)) {
                    cancelAll(branches);
                }
            });
        }

        try {
            CompletableFuture.allOf(branches.toArray(CompletableFuture[]::new))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            cancelAll(branches);
            throw new HybridSearchException("Hybrid search was interrupted", interrupted, false);
        } catch (ExecutionException executionException) {
            Throwable failure = firstFailure.get();
            throw propagate(failure == null ? unwrap(executionException) : failure);
        } catch (TimeoutException timeoutException) {
            cancelAll(branches);
            log.warn("[SEARCH] Search exceeded timeout {}ms", timeout.toMillis());
            throw new HybridSearchException(
                    "Hybrid search exceeded timeout " + timeout.toMillis() + "ms", timeoutException, true);
        }
    }

    private static void cancelAll(List<CompletableFuture<?>> branches) {
        for (CompletableFuture<?> branch : branches) {
            branch.cancel(true);
        }
    }

    private static RuntimeException propagate(Throwable failure) {
        log.warn("[SEARCH] Search branch failed (exceptionType={})", failure.getClass().getSimpleName());
        if (failure instanceof EmbeddingServiceUnavailableException embeddingFailure) {
            return embeddingFailure;
        }
        if (failure instanceof KnowledgeStoreException storeFailure) {
            return storeFailure;
        }
        return new HybridSearchException("Hybrid search failed: " + failure.getMessage(), failure, false);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static SearchResult toSearchResult(ReciprocalRankFusion.FusedCandidate candidate) {
        CandidateRow row = candidate.row();
        String previewSource = row.body() == null || row.body().isEmpty() ? row.code() : row.body();
        SearchResultMetadata metadata = new SearchResultMetadata(
                row.project(), row.repo(), row.language(), row.tags(), row.severity(), row.resolved());
        return new SearchResult(
                row.entryId(),
                row.title(),
                leading(previewSource, SUMMARY_LENGTH),
                leading(previewSource, SNIPPET_LENGTH),
                candidate.score(),
                metadata);
    }

    private static String leading(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
        return text.substring(0, end);
    }
}
