package com.williamcallahan.agentknowledge.web;

import com.williamcallahan.agentknowledge.domain.SearchRequest;
import com.williamcallahan.agentknowledge.domain.SearchResponse;
import com.williamcallahan.agentknowledge.domain.StoreEntryRequest;
import com.williamcallahan.agentknowledge.domain.StoreOutcome;
import com.williamcallahan.agentknowledge.service.EntryIngestionService;
import com.williamcallahan.agentknowledge.service.HybridSearchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Store and search endpoints for knowledge entries.
 */
@RestController
@RequestMapping("/api")
public class KnowledgeController extends BaseController {

    private final EntryIngestionService entryIngestionService;
    private final HybridSearchService hybridSearchService;

    public KnowledgeController(
            EntryIngestionService entryIngestionService,
            HybridSearchService hybridSearchService,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.entryIngestionService = entryIngestionService;
        this.hybridSearchService = hybridSearchService;
    }

    /**
     * Stores an entry. Responds 201 for a new entry and 200 when the content already exists.
     */
    @PostMapping("/entries")
    public ResponseEntity<StoreOutcome> storeEntry(@RequestBody StoreEntryRequest request) {
        StoreOutcome outcome = entryIngestionService.store(request);
        HttpStatus status = outcome.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcome);
    }

    @PostMapping("/search")
    public SearchResponse search(@Valid @RequestBody SearchRequest request) {
        return hybridSearchService.search(request);
    }
}
