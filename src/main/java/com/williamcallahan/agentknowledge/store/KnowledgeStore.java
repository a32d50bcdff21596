package com.williamcallahan.agentknowledge.store;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for entries, links, and chunk embeddings.
 *
 * <p>Implementations translate backend failures into {@link KnowledgeStoreException} and report
 * content-hash collisions on insert as {@link DuplicateContentHashException}. Entries are append-only.</p>
 */
public interface KnowledgeStore {

    /**
     * Looks up an entry by its content fingerprint.
     *
     * @param contentHash lowercase hex SHA-256 fingerprint
     * @return the entry id, or empty when no entry has this hash
     */
    Optional<UUID> findEntryIdByHash(String contentHash);

    /**
     * Persists a new entry and assigns its id and creation time.
     *
     * @param entry entry to insert
     * @return generated entry id
     * @throws DuplicateContentHashException when another entry already holds the same content hash
     */
    UUID insertEntry(NewEntry entry);

    /**
     * Inserts links, ignoring rows that already exist and links whose target entry is unknown.
     *
     * @param links links to insert
     * @return number of rows actually inserted
     */
    int upsertLinks(List<EntryLink> links);

    /**
     * Full-text ranked query over entries matching the filter.
     *
     * <p>Every filtered entry is ranked, including entries that share no term with the query;
     * those rank zero and follow the matching entries in creation order.</p>
     *
     * @param query free-text query
     * @param filter constraints applied before ranking
     * @param limit maximum number of rows
     * @return rows ordered by native text rank, best first
     */
    List<CandidateRow> lexicalSearch(String query, EntryFilter filter, int limit);

    /**
     * Nearest-neighbour query over chunk embeddings of entries matching the filter.
     *
     * <p>Each entry appears at most once, represented by its most similar chunk.</p>
     *
     * @param queryVector unit-length query vector
     * @param filter constraints applied before ranking
     * @param limit maximum number of rows
     * @return rows ordered by similarity ({@code 1 - inner product distance}), best first
     */
    List<CandidateRow> vectorSearch(float[] queryVector, EntryFilter filter, int limit);

    /**
     * Inserts chunk embeddings for one or more entries in a single batch.
     *
     * @param embeddings rows to insert
     */
    void insertEmbeddings(List<ChunkEmbedding> embeddings);

    /**
     * Verifies the backend is reachable and its entry storage exists.
     *
     * @throws KnowledgeStoreException when the backend cannot be reached or has no schema
     */
    void ping();
}
