package com.williamcallahan.agentknowledge.store;

import com.williamcallahan.agentknowledge.support.TransientFailureClassifier;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionOperations;

/**
 * PostgreSQL + pgvector implementation of {@link KnowledgeStore} on Spring's {@link JdbcTemplate}.
 *
 * <p>Full-text ranking uses the generated {@code search_vector} column; vector ranking uses the
 * pgvector inner product operator {@code <#>} on unit vectors, reported as {@code 1 - distance}.</p>
 */
public class JdbcKnowledgeStore implements KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcKnowledgeStore.class);

    private static final String FIND_BY_HASH_SQL = "select id from entries where content_hash = ? limit 1";

    private static final String INSERT_ENTRY_SQL = """
            insert into entries (
              type, title, body, stack_trace, code, repro_steps, root_cause, resolution, severity, tags,
              project, repo, "commit", branch, os, runtime, language, framework, resolved, content_hash
            ) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::text[], ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            returning id""";

    private static final String INSERT_LINK_SQL = """
            insert into links (from_entry_id, to_entry_id, relation)
            select ?, ?, ?
             where exists (select 1 from entries where id = ?)
            on conflict (from_entry_id, to_entry_id, relation) do nothing""";

    private static final String INSERT_EMBEDDING_SQL =
            "insert into embeddings (entry_id, chunk_id, chunk_text, embedding) values (?, ?, ?, ?::vector)";

    private static final String LEXICAL_SQL_TEMPLATE = """
            select id, title, body, code, project, repo, language, tags, severity, resolved,
                   ts_rank(search_vector, plainto_tsquery(?::regconfig, ?)) as native_score
              from entries
             where 1 = 1%s
             order by native_score desc nulls last, created_at asc
             limit ?""";

    private static final String VECTOR_SQL_TEMPLATE = """
            select best.* from (
              select distinct on (e.id)
                     e.id, e.title, e.body, e.code, e.project, e.repo, e.language, e.tags, e.severity, e.resolved,
                     1 - (m.embedding <#> ?::vector) as native_score
                from embeddings m
                join entries e on e.id = m.entry_id
               where 1 = 1%s
               order by e.id, m.embedding <#> ?::vector asc
            ) best
            order by best.native_score desc
            limit ?""";

    private static final String PING_SQL = "select count(*) from (select 1 from entries limit 1) sample";

    private static final String ENTRY_ALIAS = "e";

    private static final RowMapper<CandidateRow> CANDIDATE_ROW_MAPPER = JdbcKnowledgeStore::mapCandidateRow;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations transactionOperations;
    private final String textSearchConfig;

    /**
     * Creates a JDBC-backed store.
     *
     * @param jdbcTemplate template bound to a PostgreSQL data source with pgvector installed
     * @param transactionOperations transaction boundary for multi-row writes
     * @param textSearchConfig text search configuration used for query parsing
     */
    public JdbcKnowledgeStore(
            JdbcTemplate jdbcTemplate, TransactionOperations transactionOperations, String textSearchConfig) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.transactionOperations = Objects.requireNonNull(transactionOperations, "transactionOperations");
        this.textSearchConfig = Objects.requireNonNull(textSearchConfig, "textSearchConfig");
    }

    @Override
    public Optional<UUID> findEntryIdByHash(String contentHash) {
        Objects.requireNonNull(contentHash, "contentHash");
        return translate("find entry by hash", () -> jdbcTemplate
                .query(FIND_BY_HASH_SQL, (resultSet, rowNumber) -> resultSet.getObject("id", UUID.class), contentHash)
                .stream()
                .findFirst());
    }

    @Override
    public UUID insertEntry(NewEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return translate("insert entry", () -> {
            try {
                UUID entryId = jdbcTemplate.queryForObject(
                        INSERT_ENTRY_SQL,
                        UUID.class,
                        entry.kind().wireName(),
                        entry.title(),
                        entry.body(),
                        entry.stackTrace(),
                        entry.code(),
                        entry.reproSteps(),
                        entry.rootCause(),
                        entry.resolution(),
                        entry.severity() == null ? null : entry.severity().wireName(),
                        entry.tags().toArray(new String[0]),
                        entry.metadata().project(),
                        entry.metadata().repo(),
                        entry.metadata().commit(),
                        entry.metadata().branch(),
                        entry.metadata().os(),
                        entry.metadata().runtime(),
                        entry.metadata().language(),
                        entry.metadata().framework(),
                        entry.resolved(),
                        entry.contentHash());
                if (entryId == null) {
                    throw new KnowledgeStoreException("Entry insert returned no id", false);
                }
                return entryId;
            } catch (DuplicateKeyException duplicateKeyException) {
                throw new DuplicateContentHashException(entry.contentHash(), duplicateKeyException);
            }
        });
    }

    @Override
    public int upsertLinks(List<EntryLink> links) {
        if (links == null || links.isEmpty()) {
            return 0;
        }
        List<Object[]> batchArguments = links.stream()
                .map(link -> new Object[] {link.fromEntryId(), link.toEntryId(), link.relation(), link.toEntryId()})
                .toList();
        int[] updateCounts = translate("upsert links", () -> transactionOperations.execute(
                status -> jdbcTemplate.batchUpdate(INSERT_LINK_SQL, batchArguments)));
        int inserted = updateCounts == null
                ? 0
                : Arrays.stream(updateCounts).filter(count -> count > 0).sum();
        if (inserted < links.size()) {
            log.debug("[STORE] Inserted {} of {} links (existing or unknown targets skipped)", inserted, links.size());
        }
        return inserted;
    }

    @Override
    public List<CandidateRow> lexicalSearch(String query, EntryFilter filter, int limit) {
        Objects.requireNonNull(query, "query");
        EntryFilterSqlBuilder.SqlPredicate predicate = EntryFilterSqlBuilder.build(filter, "");
        String sql = String.format(LEXICAL_SQL_TEMPLATE, predicate.asAndClause());

        List<Object> parameters = new ArrayList<>();
        parameters.add(textSearchConfig);
        parameters.add(query);
        parameters.addAll(predicate.parameters());
        parameters.add(limit);

        return translate(
                "lexical search", () -> jdbcTemplate.query(sql, CANDIDATE_ROW_MAPPER, parameters.toArray()));
    }

    @Override
    public List<CandidateRow> vectorSearch(float[] queryVector, EntryFilter filter, int limit) {
        String vectorLiteral = PgVectorLiteral.format(queryVector);
        EntryFilterSqlBuilder.SqlPredicate predicate = EntryFilterSqlBuilder.build(filter, ENTRY_ALIAS);
        String sql = String.format(VECTOR_SQL_TEMPLATE, predicate.asAndClause());

        List<Object> parameters = new ArrayList<>();
        parameters.add(vectorLiteral);
        parameters.addAll(predicate.parameters());
        parameters.add(vectorLiteral);
        parameters.add(limit);

        return translate(
                "vector search", () -> jdbcTemplate.query(sql, CANDIDATE_ROW_MAPPER, parameters.toArray()));
    }

    @Override
    public void insertEmbeddings(List<ChunkEmbedding> embeddings) {
        if (embeddings == null || embeddings.isEmpty()) {
            return;
        }
        List<Object[]> batchArguments = embeddings.stream()
                .map(embedding -> new Object[] {
                    embedding.entryId(),
                    embedding.chunkIndex(),
                    embedding.chunkText(),
                    PgVectorLiteral.format(embedding.vector())
                })
                .toList();
        translate("insert embeddings", () -> transactionOperations.execute(
                status -> jdbcTemplate.batchUpdate(INSERT_EMBEDDING_SQL, batchArguments)));
        log.debug("[STORE] Inserted {} embedding rows", embeddings.size());
    }

    @Override
    public void ping() {
        translate("ping", () -> jdbcTemplate.queryForObject(PING_SQL, Integer.class));
    }

    private static <T> T translate(String operationName, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException dataAccessException) {
            boolean transientFailure = TransientFailureClassifier.isTransient(dataAccessException);
            throw new KnowledgeStoreException(
                    "Knowledge store " + operationName + " failed: " + dataAccessException.getMostSpecificCause().getMessage(),
                    transientFailure,
                    dataAccessException);
        }
    }

    private static CandidateRow mapCandidateRow(ResultSet resultSet, int rowNumber) throws SQLException {
        double nativeScore = resultSet.getDouble("native_score");
        if (resultSet.wasNull()) {
            nativeScore = 0.0d;
        }
        return new CandidateRow(
                resultSet.getObject("id", UUID.class),
                resultSet.getString("title"),
                resultSet.getString("body"),
                resultSet.getString("code"),
                resultSet.getString("project"),
                resultSet.getString("repo"),
                resultSet.getString("language"),
                readTags(resultSet.getArray("tags")),
                resultSet.getString("severity"),
                resultSet.getBoolean("resolved"),
                nativeScore);
    }

    private static List<String> readTags(Array tagsArray) throws SQLException {
        if (tagsArray == null) {
            return List.of();
        }
        try {
            Object[] values = (Object[]) tagsArray.getArray();
            List<String> tags = new ArrayList<>(values.length);
            for (Object value : values) {
                if (value != null) {
                    tags.add(value.toString());
                }
            }
            return tags;
        } finally {
            tagsArray.free();
        }
    }
}
