package com.williamcallahan.agentknowledge.web;

import com.williamcallahan.agentknowledge.domain.ingestion.LocalDocsIngestionSummary;
import com.williamcallahan.agentknowledge.service.ingestion.LocalDocsIngestionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ingest")
public class IngestionController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);
    private static final int MAX_ALLOWED_FILES = 1_000_000;

    private final LocalDocsIngestionService localDocsIngestionService;

    public IngestionController(
            LocalDocsIngestionService localDocsIngestionService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.localDocsIngestionService = localDocsIngestionService;
    }

    @PostMapping("/local")
    public LocalDocsIngestionSummary ingestLocal(
            @RequestParam(name = "dir", defaultValue = "docs") String dir,
            @RequestParam(name = "project", required = false) String project,
            @RequestParam(name = "repo", required = false) String repo,
            @RequestParam(name = "tags", required = false) List<String> tags,
            @RequestParam(name = "maxFiles", defaultValue = "50000")
                    @Min(value = 1, message = "maxFiles must be at least 1")
                    @Max(value = MAX_ALLOWED_FILES, message = "maxFiles cannot exceed " + MAX_ALLOWED_FILES)
                    int maxFiles)
            throws IOException {
        log.info("Starting local docs ingestion for up to {} files", maxFiles);
        List<String> cleanedTags = tags == null
                ? List.of()
                : tags.stream().map(String::trim).filter(tag -> !tag.isEmpty()).toList();
        return localDocsIngestionService.ingestDirectory(dir, project, repo, cleanedTags, maxFiles);
    }
}
