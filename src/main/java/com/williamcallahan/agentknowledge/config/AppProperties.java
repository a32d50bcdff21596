package com.williamcallahan.agentknowledge.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private ChunkingSettings chunking = new ChunkingSettings();
    private SearchSettings search = new SearchSettings();
    private EmbeddingSettings embeddings = new EmbeddingSettings();
    private StoreSettings store = new StoreSettings();
    private RetrySettings retry = new RetrySettings();

    /**
     * Validates every section after binding so bad settings fail startup.
     */
    @PostConstruct
    public void validateConfiguration() {
        chunking.validateConfiguration();
        search.validateConfiguration();
        embeddings.validateConfiguration();
        store.validateConfiguration();
        retry.validateConfiguration();
    }

    public ChunkingSettings getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingSettings chunking) {
        this.chunking = chunking;
    }

    public SearchSettings getSearch() {
        return search;
    }

    public void setSearch(SearchSettings search) {
        this.search = search;
    }

    public EmbeddingSettings getEmbeddings() {
        return embeddings;
    }

    public void setEmbeddings(EmbeddingSettings embeddings) {
        this.embeddings = embeddings;
    }

    public StoreSettings getStore() {
        return store;
    }

    public void setStore(StoreSettings store) {
        this.store = store;
    }

    public RetrySettings getRetry() {
        return retry;
    }

    public void setRetry(RetrySettings retry) {
        this.retry = retry;
    }
}
