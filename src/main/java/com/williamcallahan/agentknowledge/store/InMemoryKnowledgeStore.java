package com.williamcallahan.agentknowledge.store;

import com.williamcallahan.agentknowledge.support.LexicalTokenizer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link KnowledgeStore} for development runs and tests.
 *
 * <p>Lexical ranking approximates PostgreSQL's weighted {@code ts_rank}: title and stack trace terms
 * weigh more than body and code terms, and only entries sharing a term with the query are returned.
 * Vector similarity mirrors the JDBC store: {@code 1 + dot(query, chunk)} for unit vectors.</p>
 */
public class InMemoryKnowledgeStore implements KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeStore.class);

    private static final double WEIGHT_A = 1.0d;
    private static final double WEIGHT_B = 0.4d;

    private final Clock clock;
    private final AtomicLong insertionSequence = new AtomicLong();
    private final Map<UUID, StoredEntry> entriesById = new ConcurrentHashMap<>();
    private final Map<String, UUID> entryIdsByHash = new ConcurrentHashMap<>();
    private final Set<EntryLink> links = ConcurrentHashMap.newKeySet();
    private final Map<UUID, List<ChunkEmbedding>> embeddingsByEntry = new ConcurrentHashMap<>();

    public InMemoryKnowledgeStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store whose creation timestamps come from the given clock.
     */
    public InMemoryKnowledgeStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("[STORE] Using in-memory knowledge store (contents are lost on shutdown)");
    }

    @Override
    public Optional<UUID> findEntryIdByHash(String contentHash) {
        Objects.requireNonNull(contentHash, "contentHash");
        return Optional.ofNullable(entryIdsByHash.get(contentHash));
    }

    @Override
    public UUID insertEntry(NewEntry entry) {
        Objects.requireNonNull(entry, "entry");
        UUID entryId = UUID.randomUUID();
        UUID existingId = entryIdsByHash.putIfAbsent(entry.contentHash(), entryId);
        if (existingId != null) {
            throw new DuplicateContentHashException(entry.contentHash(), null);
        }
        entriesById.put(
                entryId,
                new StoredEntry(entryId, insertionSequence.incrementAndGet(), Instant.now(clock), entry));
        return entryId;
    }

    @Override
    public int upsertLinks(List<EntryLink> linksToInsert) {
        if (linksToInsert == null || linksToInsert.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        for (EntryLink link : linksToInsert) {
            if (!entriesById.containsKey(link.fromEntryId()) || !entriesById.containsKey(link.toEntryId())) {
                continue;
            }
            if (links.add(link)) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public List<CandidateRow> lexicalSearch(String query, EntryFilter filter, int limit) {
        Objects.requireNonNull(query, "query");
        Set<String> queryTerms = new HashSet<>(LexicalTokenizer.tokenize(query));
        if (limit <= 0) {
            return List.of();
        }
        List<ScoredEntry> scoredEntries = new ArrayList<>();
        for (StoredEntry storedEntry : entriesInInsertionOrder()) {
            if (!matches(storedEntry, filter)) {
                continue;
            }
            double weightedMatches = weightedTermMatches(storedEntry.entry(), queryTerms);
            scoredEntries.add(new ScoredEntry(storedEntry, weightedMatches / (weightedMatches + 1.0d)));
        }
        return rank(scoredEntries, limit);
    }

    @Override
    public List<CandidateRow> vectorSearch(float[] queryVector, EntryFilter filter, int limit) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (limit <= 0) {
            return List.of();
        }
        List<ScoredEntry> scoredEntries = new ArrayList<>();
        for (StoredEntry storedEntry : entriesInInsertionOrder()) {
            List<ChunkEmbedding> chunks = embeddingsByEntry.getOrDefault(storedEntry.id(), List.of());
            if (chunks.isEmpty() || !matches(storedEntry, filter)) {
                continue;
            }
            double bestSimilarity = Double.NEGATIVE_INFINITY;
            for (ChunkEmbedding chunk : chunks) {
                bestSimilarity = Math.max(bestSimilarity, 1.0d + dot(queryVector, chunk.vector()));
            }
            scoredEntries.add(new ScoredEntry(storedEntry, bestSimilarity));
        }
        return rank(scoredEntries, limit);
    }

    @Override
    public void insertEmbeddings(List<ChunkEmbedding> embeddings) {
        if (embeddings == null || embeddings.isEmpty()) {
            return;
        }
        for (ChunkEmbedding embedding : embeddings) {
            if (!entriesById.containsKey(embedding.entryId())) {
                throw new KnowledgeStoreException(
                        "Cannot insert embedding for unknown entry " + embedding.entryId(), false);
            }
        }
        for (ChunkEmbedding embedding : embeddings) {
            List<ChunkEmbedding> chunks =
                    embeddingsByEntry.computeIfAbsent(embedding.entryId(), id -> new CopyOnWriteArrayList<>());
            boolean duplicateChunk = chunks.stream().anyMatch(existing -> existing.chunkIndex() == embedding.chunkIndex());
            if (duplicateChunk) {
                throw new KnowledgeStoreException("Embedding for entry " + embedding.entryId() + " chunk "
                        + embedding.chunkIndex() + " already exists", false);
            }
            chunks.add(embedding);
        }
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Returns the number of stored entries.
     */
    public int entryCount() {
        return entriesById.size();
    }

    /**
     * Returns the stored chunk embeddings of an entry in insertion order.
     */
    public List<ChunkEmbedding> embeddingsFor(UUID entryId) {
        return Collections.unmodifiableList(new ArrayList<>(embeddingsByEntry.getOrDefault(entryId, List.of())));
    }

    /**
     * Returns all stored links.
     */
    public Set<EntryLink> links() {
        return Set.copyOf(links);
    }

    /**
     * Returns the stored form of an entry, if present.
     */
    public Optional<NewEntry> findEntry(UUID entryId) {
        StoredEntry storedEntry = entriesById.get(entryId);
        return storedEntry == null ? Optional.empty() : Optional.of(storedEntry.entry());
    }

    private List<StoredEntry> entriesInInsertionOrder() {
        List<StoredEntry> ordered = new ArrayList<>(entriesById.values());
        ordered.sort(Comparator.comparingLong(StoredEntry::sequence));
        return ordered;
    }

    private static List<CandidateRow> rank(List<ScoredEntry> scoredEntries, int limit) {
        // stable sort keeps insertion order among equal scores
        scoredEntries.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());
        return scoredEntries.stream()
                .limit(limit)
                .map(scored -> toCandidateRow(scored.storedEntry(), scored.score()))
                .toList();
    }

    private static boolean matches(StoredEntry storedEntry, EntryFilter filter) {
        if (filter == null) {
            return true;
        }
        NewEntry entry = storedEntry.entry();
        if (filter.project() != null && !filter.project().equals(entry.metadata().project())) {
            return false;
        }
        if (filter.repo() != null && !filter.repo().equals(entry.metadata().repo())) {
            return false;
        }
        if (filter.language() != null && !filter.language().equals(entry.metadata().language())) {
            return false;
        }
        if (filter.severity() != null && filter.severity() != entry.severity()) {
            return false;
        }
        if (filter.resolved() != null && filter.resolved() != entry.resolved()) {
            return false;
        }
        if (filter.since() != null && storedEntry.createdAt().isBefore(filter.since())) {
            return false;
        }
        return filter.tags().isEmpty() || entry.tags().stream().anyMatch(filter.tags()::contains);
    }

    private static double weightedTermMatches(NewEntry entry, Set<String> queryTerms) {
        return WEIGHT_A * countMatches(entry.title(), queryTerms)
                + WEIGHT_B * countMatches(entry.body(), queryTerms)
                + WEIGHT_B * countMatches(entry.code(), queryTerms)
                + WEIGHT_A * countMatches(entry.stackTrace(), queryTerms);
    }

    private static int countMatches(String text, Set<String> queryTerms) {
        int matches = 0;
        for (String token : LexicalTokenizer.tokenize(text)) {
            if (queryTerms.contains(token)) {
                matches++;
            }
        }
        return matches;
    }

    private static double dot(float[] queryVector, float[] chunkVector) {
        if (queryVector.length != chunkVector.length) {
            throw new KnowledgeStoreException("Vector dimension mismatch: query has " + queryVector.length
                    + " dimensions but stored chunk has " + chunkVector.length, false);
        }
        double sum = 0.0d;
        for (int index = 0; index < queryVector.length; index++) {
            sum += (double) queryVector[index] * chunkVector[index];
        }
        return sum;
    }

    private static CandidateRow toCandidateRow(StoredEntry storedEntry, double nativeScore) {
        NewEntry entry = storedEntry.entry();
        return new CandidateRow(
                storedEntry.id(),
                entry.title(),
                entry.body(),
                entry.code(),
                entry.metadata().project(),
                entry.metadata().repo(),
                entry.metadata().language(),
                entry.tags(),
                entry.severity() == null ? null : entry.severity().wireName(),
                entry.resolved(),
                nativeScore);
    }

    private record StoredEntry(UUID id, long sequence, Instant createdAt, NewEntry entry) {}

    private record ScoredEntry(StoredEntry storedEntry, double score) {}
}
