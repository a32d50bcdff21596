package com.williamcallahan.agentknowledge.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.agentknowledge.domain.EntryKind;
import com.williamcallahan.agentknowledge.domain.EntryMetadata;
import com.williamcallahan.agentknowledge.domain.Severity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryKnowledgeStoreTest {

    private static final Instant CREATED_AT = Instant.parse("2025-06-01T12:00:00Z");

    private InMemoryKnowledgeStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKnowledgeStore(Clock.fixed(CREATED_AT, ZoneOffset.UTC));
    }

    @Test
    void insertsAndFindsByHash() {
        UUID entryId = store.insertEntry(entry("Pool exhausted", "hash-1", "billing", List.of("db")));

        assertEquals(Optional.of(entryId), store.findEntryIdByHash("hash-1"));
        assertEquals(Optional.empty(), store.findEntryIdByHash("hash-2"));
        assertEquals(1, store.entryCount());
    }

    @Test
    void rejectsSecondInsertWithSameHash() {
        store.insertEntry(entry("Pool exhausted", "hash-1", null, List.of()));

        DuplicateContentHashException thrown = assertThrows(
                DuplicateContentHashException.class,
                () -> store.insertEntry(entry("Pool exhausted again", "hash-1", null, List.of())));
        assertEquals("hash-1", thrown.getContentHash());
        assertEquals(1, store.entryCount());
    }

    @Test
    void lexicalSearchRanksTitleMatchesFirstAndKeepsNonMatchingEntriesAtZero() {
        UUID unrelated = store.insertEntry(entry("Unrelated flaky test", "h-none", null, List.of()));
        UUID bodyMatch = store.insertEntry(new NewEntry(EntryKind.DOC, "Operations guide", "Restart the connection pool.",
                null, null, null, null, null, null, List.of(), EntryMetadata.empty(), false, "h-body"));
        UUID titleMatch = store.insertEntry(entry("Connection pool exhausted", "h-title", null, List.of()));

        List<CandidateRow> rows = store.lexicalSearch("connection pool", EntryFilter.none(), 10);

        assertEquals(List.of(titleMatch, bodyMatch, unrelated), rows.stream().map(CandidateRow::entryId).toList());
        assertTrue(rows.get(0).nativeScore() > rows.get(1).nativeScore());
        assertEquals(0.0d, rows.get(2).nativeScore(), 1e-9);
    }

    @Test
    void lexicalSearchWithOnlyStopWordsRanksEveryEntryAtZeroInCreationOrder() {
        UUID first = store.insertEntry(entry("The pool", "h-1", null, List.of()));
        UUID second = store.insertEntry(entry("Another pool", "h-2", null, List.of()));

        List<CandidateRow> rows = store.lexicalSearch("the and of", EntryFilter.none(), 10);

        assertEquals(List.of(first, second), ids(rows));
        assertTrue(rows.stream().allMatch(row -> row.nativeScore() == 0.0d));
    }

    @Test
    void zeroRankEntriesStillFillTheLimit() {
        store.insertEntry(entry("Pool exhausted", "h-1", null, List.of()));
        store.insertEntry(entry("Cache miss storm", "h-2", null, List.of()));
        store.insertEntry(entry("Flaky login test", "h-3", null, List.of()));

        assertEquals(2, store.lexicalSearch("pool", EntryFilter.none(), 2).size());
        assertEquals(3, store.lexicalSearch("pool", EntryFilter.none(), 10).size());
    }

    @Test
    void vectorSearchRanksByBestChunkSimilarity() {
        UUID near = store.insertEntry(entry("Near", "h-near", null, List.of()));
        UUID far = store.insertEntry(entry("Far", "h-far", null, List.of()));
        store.insertEntry(entry("Not embedded", "h-none", null, List.of()));
        store.insertEmbeddings(List.of(
                new ChunkEmbedding(near, 0, "a", new float[] {0.0f, 1.0f}),
                new ChunkEmbedding(near, 1, "b", new float[] {1.0f, 0.0f}),
                new ChunkEmbedding(far, 0, "c", new float[] {-1.0f, 0.0f})));

        List<CandidateRow> rows = store.vectorSearch(new float[] {1.0f, 0.0f}, EntryFilter.none(), 10);

        assertEquals(List.of(near, far), rows.stream().map(CandidateRow::entryId).toList());
        assertEquals(2.0d, rows.get(0).nativeScore(), 1e-9);
        assertEquals(0.0d, rows.get(1).nativeScore(), 1e-9);
    }

    @Test
    void filtersApplyToBothQueries() {
        UUID billing = store.insertEntry(entry("Pool exhausted", "h-1", "billing", List.of("db")));
        UUID search = store.insertEntry(entry("Pool exhausted in search", "h-2", "search", List.of("db")));
        store.insertEmbeddings(List.of(
                new ChunkEmbedding(billing, 0, "a", new float[] {1.0f, 0.0f}),
                new ChunkEmbedding(search, 0, "b", new float[] {1.0f, 0.0f})));
        EntryFilter billingOnly = new EntryFilter("billing", null, null, null, null, null, List.of());

        assertEquals(List.of(billing), ids(store.lexicalSearch("pool", billingOnly, 10)));
        assertEquals(List.of(billing), ids(store.vectorSearch(new float[] {1.0f, 0.0f}, billingOnly, 10)));
    }

    @Test
    void tagFilterMatchesAnySharedTag() {
        UUID tagged = store.insertEntry(entry("Pool exhausted", "h-1", null, List.of("db", "pool")));
        store.insertEntry(entry("Pool resized", "h-2", null, List.of("ops")));
        EntryFilter tagFilter = new EntryFilter(null, null, null, null, null, null, List.of("cache", "db"));

        assertEquals(List.of(tagged), ids(store.lexicalSearch("pool", tagFilter, 10)));
    }

    @Test
    void sinceFilterComparesCreationTime() {
        store.insertEntry(entry("Pool exhausted", "h-1", null, List.of()));

        EntryFilter atCreation = new EntryFilter(null, null, null, null, null, CREATED_AT, List.of());
        EntryFilter afterCreation =
                new EntryFilter(null, null, null, null, null, CREATED_AT.plusSeconds(1), List.of());

        assertEquals(1, store.lexicalSearch("pool", atCreation, 10).size());
        assertTrue(store.lexicalSearch("pool", afterCreation, 10).isEmpty());
    }

    @Test
    void severityAndResolvedFiltersMatchExactly() {
        store.insertEntry(new NewEntry(EntryKind.BUG, "Pool exhausted", null, null, null, null, null, null,
                Severity.HIGH, List.of(), EntryMetadata.empty(), false, "h-1"));
        UUID resolved = store.insertEntry(new NewEntry(EntryKind.SOLUTION, "Pool fix", null, null, null, null, null,
                "Raise the limit", Severity.LOW, List.of(), EntryMetadata.empty(), true, "h-2"));

        EntryFilter resolvedLow = new EntryFilter(null, null, null, Severity.LOW, true, null, List.of());

        assertEquals(List.of(resolved), ids(store.lexicalSearch("pool", resolvedLow, 10)));
    }

    @Test
    void limitTruncatesRanking() {
        for (int index = 0; index < 5; index++) {
            store.insertEntry(entry("Pool note " + index, "h-" + index, null, List.of()));
        }

        assertEquals(2, store.lexicalSearch("pool", EntryFilter.none(), 2).size());
    }

    @Test
    void linksSkipUnknownEntriesAndIgnoreRepeats() {
        UUID first = store.insertEntry(entry("First", "h-1", null, List.of()));
        UUID second = store.insertEntry(entry("Second", "h-2", null, List.of()));

        int inserted = store.upsertLinks(List.of(
                EntryLink.relatesTo(first, second),
                EntryLink.relatesTo(first, second),
                EntryLink.relatesTo(first, UUID.randomUUID())));

        assertEquals(1, inserted);
        assertEquals(Set.of(EntryLink.relatesTo(first, second)), store.links());
    }

    @Test
    void embeddingsRequireKnownEntryAndUniqueChunkIndex() {
        UUID entryId = store.insertEntry(entry("First", "h-1", null, List.of()));
        store.insertEmbeddings(List.of(new ChunkEmbedding(entryId, 0, "a", new float[] {1.0f})));

        assertThrows(
                KnowledgeStoreException.class,
                () -> store.insertEmbeddings(List.of(new ChunkEmbedding(UUID.randomUUID(), 0, "a", new float[] {1.0f}))));
        assertThrows(
                KnowledgeStoreException.class,
                () -> store.insertEmbeddings(List.of(new ChunkEmbedding(entryId, 0, "again", new float[] {1.0f}))));
        assertEquals(1, store.embeddingsFor(entryId).size());
    }

    private static NewEntry entry(String title, String contentHash, String project, List<String> tags) {
        return new NewEntry(
                EntryKind.BUG,
                title,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                tags,
                new EntryMetadata(project, null, null, null, null, null, null, null),
                false,
                contentHash);
    }

    private static List<UUID> ids(List<CandidateRow> rows) {
        return rows.stream().map(CandidateRow::entryId).toList();
    }
}
