package com.williamcallahan.agentknowledge.service.ingestion;

import com.williamcallahan.agentknowledge.domain.EntryKind;
import com.williamcallahan.agentknowledge.domain.EntryMetadata;
import com.williamcallahan.agentknowledge.domain.StoreEntryRequest;
import com.williamcallahan.agentknowledge.domain.StoreOutcome;
import com.williamcallahan.agentknowledge.domain.ingestion.LocalDocsIngestionFailure;
import com.williamcallahan.agentknowledge.domain.ingestion.LocalDocsIngestionSummary;
import com.williamcallahan.agentknowledge.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.agentknowledge.service.EntryEmbeddingException;
import com.williamcallahan.agentknowledge.service.EntryIngestionService;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stores local Markdown and text documentation files as {@code doc} entries.
 */
@Service
public class LocalDocsIngestionService {
    private static final Logger log = LoggerFactory.getLogger(LocalDocsIngestionService.class);

    private static final List<String> DOC_EXTENSIONS = List.of(".md", ".mdx", ".txt");
    private static final String PHASE_READ = "read";
    private static final String PHASE_STORE = "store";

    private final EntryIngestionService entryIngestionService;

    public LocalDocsIngestionService(EntryIngestionService entryIngestionService) {
        this.entryIngestionService = Objects.requireNonNull(entryIngestionService, "entryIngestionService");
    }

    /**
     * Walks a directory and stores every documentation file found, in path order.
     *
     * @param rootDir directory to scan recursively
     * @param project project recorded on each entry, may be null
     * @param repo repository recorded on each entry, may be null
     * @param tags tags applied to each entry
     * @param maxFiles maximum number of files to visit
     * @return counts and per-file failures
     * @throws IOException if the directory cannot be walked
     */
    public LocalDocsIngestionSummary ingestDirectory(
            String rootDir, String project, String repo, List<String> tags, int maxFiles) throws IOException {
        if (rootDir == null || rootDir.isBlank()) {
            throw new IllegalArgumentException("Local docs directory is required");
        }
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive");
        }
        Path root = Path.of(rootDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Local docs directory does not exist: " + rootDir);
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(LocalDocsIngestionService::isDocFile)
                    .sorted()
                    .limit(maxFiles)
                    .toList();
        }

        EntryMetadata metadata = EntryMetadata.forLocalDocs(project, repo);
        List<String> entryTags = tags == null ? List.of() : tags;
        int created = 0;
        int duplicates = 0;
        List<LocalDocsIngestionFailure> failures = new ArrayList<>();
        for (Path file : files) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException readFailure) {
                log.warn("[INGEST] Could not read {}: {}", file, readFailure.getMessage());
                failures.add(new LocalDocsIngestionFailure(file.toString(), PHASE_READ, describe(readFailure)));
                continue;
            }

            StoreEntryRequest request = StoreEntryRequest.builder(EntryKind.DOC.wireName(), fileTitle(file))
                    .body(content)
                    .tags(entryTags)
                    .metadata(metadata)
                    .build();
            try {
                StoreOutcome outcome = entryIngestionService.store(request);
                if (outcome.created()) {
                    created++;
                } else {
                    duplicates++;
                }
            } catch (IllegalArgumentException
                    | KnowledgeStoreException
                    | EmbeddingServiceUnavailableException
                    | EntryEmbeddingException storeFailure) {
                log.warn("[INGEST] Could not store {}: {}", file, storeFailure.getMessage());
                failures.add(new LocalDocsIngestionFailure(file.toString(), PHASE_STORE, describe(storeFailure)));
            }
        }

        log.info(
                "[INGEST] Local docs ingestion of {}: scanned={}, created={}, duplicates={}, failures={}",
                root,
                files.size(),
                created,
                duplicates,
                failures.size());
        return LocalDocsIngestionSummary.of(rootDir, files.size(), created, duplicates, failures);
    }

    private static boolean isDocFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return DOC_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private static String fileTitle(Path file) {
        Path fileName = file.getFileName();
        return fileName == null ? file.toString() : fileName.toString();
    }

    private static String describe(Exception failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
