package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.config.AppProperties;
import com.williamcallahan.agentknowledge.config.RetrySettings;
import com.williamcallahan.agentknowledge.domain.EntryKind;
import com.williamcallahan.agentknowledge.domain.Severity;
import com.williamcallahan.agentknowledge.domain.StoreEntryRequest;
import com.williamcallahan.agentknowledge.domain.StoreOutcome;
import com.williamcallahan.agentknowledge.store.ChunkEmbedding;
import com.williamcallahan.agentknowledge.store.DuplicateContentHashException;
import com.williamcallahan.agentknowledge.store.EntryLink;
import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import com.williamcallahan.agentknowledge.store.NewEntry;
import com.williamcallahan.agentknowledge.support.RetrySupport;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stores knowledge entries: redaction, fingerprinting, deduplication, persistence, linking, and
 * chunk embedding.
 *
 * <p>Steps run strictly in sequence. The content-hash unique index is the only guard against
 * concurrent stores of the same content, so an insert that loses that race is reported as a
 * duplicate of the winner. An embedding failure after the insert leaves the entry in place and is
 * raised as {@link EntryEmbeddingException}.</p>
 */
@Service
public class EntryIngestionService {
    private static final Logger log = LoggerFactory.getLogger(EntryIngestionService.class);

    private static final String FIELD_SEPARATOR = "\n\n";

    private final KnowledgeStore knowledgeStore;
    private final SecretRedactor secretRedactor;
    private final ContentHasher contentHasher;
    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final RetrySettings retrySettings;

    /**
     * Creates the ingestion service from its collaborators.
     */
    public EntryIngestionService(
            KnowledgeStore knowledgeStore,
            SecretRedactor secretRedactor,
            ContentHasher contentHasher,
            Chunker chunker,
            EmbeddingClient embeddingClient,
            AppProperties appProperties) {
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
        this.secretRedactor = Objects.requireNonNull(secretRedactor, "secretRedactor");
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.retrySettings = Objects.requireNonNull(appProperties, "appProperties").getRetry();
    }

    /**
     * Stores an entry unless an entry with the same fingerprint already exists.
     *
     * @param request client payload
     * @return created outcome, or duplicate outcome pointing at the existing entry
     * @throws IllegalArgumentException when the request is invalid; nothing is written
     * @throws EntryEmbeddingException when the entry was written but embedding failed
     * @throws KnowledgeStoreException when the store fails before the entry is written
     */
    public StoreOutcome store(StoreEntryRequest request) {
        Objects.requireNonNull(request, "request");
        EntryKind kind = EntryKind.fromWireName(request.type());
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Entry title must not be blank");
        }
        Severity severity = Severity.parseOptional(request.severity()).orElse(null);

        if (request.idempotencyKey() != null && !request.idempotencyKey().isBlank()) {
            log.debug("[INGEST] Store request carries idempotency key");
        }

        RedactedFields redacted = redactFields(request);
        String contentHash = contentHasher.fingerprint(
                kind,
                request.title(),
                redacted.body(),
                redacted.code(),
                redacted.stackTrace(),
                redacted.reproSteps(),
                redacted.resolution());

        Optional<UUID> existingId =
                withStoreRetry(() -> knowledgeStore.findEntryIdByHash(contentHash), "Find entry by hash");
        if (existingId.isPresent()) {
            log.info("[INGEST] Duplicate content; returning existing entry {}", existingId.get());
            return StoreOutcome.duplicate(existingId.get());
        }

        boolean resolved = kind == EntryKind.SOLUTION || !redacted.resolution().trim().isEmpty();
        NewEntry newEntry = new NewEntry(
                kind,
                request.title(),
                blankToNull(redacted.body()),
                blankToNull(redacted.stackTrace()),
                blankToNull(redacted.code()),
                blankToNull(redacted.reproSteps()),
                blankToNull(redacted.rootCause()),
                blankToNull(redacted.resolution()),
                severity,
                distinctTags(request.tags()),
                request.metadata(),
                resolved,
                contentHash);

        UUID entryId;
        try {
            entryId = withStoreRetry(() -> knowledgeStore.insertEntry(newEntry), "Insert entry");
        } catch (DuplicateContentHashException duplicateException) {
            UUID winnerId = withStoreRetry(() -> knowledgeStore.findEntryIdByHash(contentHash), "Find entry by hash")
                    .orElseThrow(() -> duplicateException);
            log.info("[INGEST] Lost insert race on content hash; returning existing entry {}", winnerId);
            return StoreOutcome.duplicate(winnerId);
        }

        linkRelatedEntries(entryId, request.relatedIds());

        int chunkCount = embedAndPersistChunks(entryId, redacted);
        log.info("[INGEST] Stored {} entry {} with {} chunk(s)", kind.wireName(), entryId, chunkCount);
        return StoreOutcome.created(entryId);
    }

    private RedactedFields redactFields(StoreEntryRequest request) {
        return new RedactedFields(
                secretRedactor.redact(request.body()),
                secretRedactor.redact(request.code()),
                secretRedactor.redact(request.stackTrace()),
                secretRedactor.redact(request.reproSteps()),
                secretRedactor.redact(request.resolution()),
                secretRedactor.redact(request.rootCause()));
    }

    private void linkRelatedEntries(UUID entryId, List<UUID> relatedIds) {
        if (relatedIds.isEmpty()) {
            return;
        }
        List<EntryLink> links = new LinkedHashSet<>(relatedIds).stream()
                .map(relatedId -> EntryLink.relatesTo(entryId, relatedId))
                .toList();
        int inserted = withStoreRetry(() -> knowledgeStore.upsertLinks(links), "Upsert links");
        log.debug("[INGEST] Linked entry {} to {} of {} related entries", entryId, inserted, links.size());
    }

    private int embedAndPersistChunks(UUID entryId, RedactedFields redacted) {
        String textToChunk = redacted.chunkableText();
        if (textToChunk.isBlank()) {
            return 0;
        }
        List<String> chunks = chunker.chunk(textToChunk);
        if (chunks.isEmpty()) {
            return 0;
        }
        try {
            List<float[]> vectors = embeddingClient.embed(chunks);
            if (vectors.size() != chunks.size()) {
                throw new EmbeddingServiceUnavailableException("Embedding provider returned "
                        + vectors.size() + " vectors for " + chunks.size() + " chunks");
            }
            List<ChunkEmbedding> rows = new ArrayList<>(chunks.size());
            for (int chunkIndex = 0; chunkIndex < chunks.size(); chunkIndex++) {
                rows.add(new ChunkEmbedding(entryId, chunkIndex, chunks.get(chunkIndex), vectors.get(chunkIndex)));
            }
            withStoreRetry(
                    () -> {
                        knowledgeStore.insertEmbeddings(rows);
                        return rows.size();
                    },
                    "Insert embeddings");
            return rows.size();
        } catch (EmbeddingServiceUnavailableException | KnowledgeStoreException embeddingFailure) {
            log.error("[INGEST] Entry {} stored without embeddings: {}", entryId, embeddingFailure.getMessage());
            throw new EntryEmbeddingException(entryId, embeddingFailure);
        }
    }

    private <T> T withStoreRetry(Supplier<T> operation, String operationName) {
        return RetrySupport.executeWithRetry(
                operation, "[STORE] " + operationName, retrySettings.getMaxAttempts(), retrySettings.getInitialBackoff());
    }

    private static List<String> distinctTags(List<String> tags) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                distinct.add(tag.trim());
            }
        }
        return List.copyOf(distinct);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record RedactedFields(
            String body, String code, String stackTrace, String reproSteps, String resolution, String rootCause) {

        String chunkableText() {
            return String.join(
                    FIELD_SEPARATOR,
                    Stream.of(body, code, stackTrace, reproSteps, resolution)
                            .filter(field -> !field.isEmpty())
                            .toList());
        }
    }
}
