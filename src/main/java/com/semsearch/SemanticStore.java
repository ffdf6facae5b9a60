package com.semsearch;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.ingest.FileIndexUsage;
import com.semsearch.ingest.FileTypes;
import com.semsearch.ingest.IndexingOptions;
import com.semsearch.ingest.IndexingOrchestrator;
import com.semsearch.ingest.IndexingStats;
import com.semsearch.ingest.TextExtractor;
import com.semsearch.provider.SemanticProvider;
import com.semsearch.provider.SemanticProviders;
import com.semsearch.runtime.AppConfig;
import com.semsearch.runtime.ConfigurationException;
import com.semsearch.search.Retriever;
import com.semsearch.search.SearchOptions;
import com.semsearch.search.SearchOrchestrator;
import com.semsearch.search.SearchResult;
import com.semsearch.store.FileRecord;
import com.semsearch.store.LocalJsonVectorStore;
import com.semsearch.store.VectorIndexType;
import com.semsearch.store.VectorStore;

/**
 * Entry point for library users: wires the store, the provider and both orchestrators from one configuration.
 */
public class SemanticStore {
    private static final Logger log = LoggerFactory.getLogger(SemanticStore.class);

    private final AppConfig config;
    private final VectorStore store;
    private final SemanticProvider provider;
    private final IndexingOrchestrator indexing;
    private final SearchOrchestrator searching;

    public SemanticStore(AppConfig config, VectorStore store, SemanticProvider provider) {
        this.config = config;
        this.store = store;
        this.provider = provider;
        this.indexing = new IndexingOrchestrator(
                store,
                provider,
                new TextExtractor(),
                new FileTypes(config.getIndexing().getExtensions()),
                config.getIndexing().getMaxChars());
        AppConfig.SearchConfig search = config.getSearch();
        this.searching = new SearchOrchestrator(
                new Retriever(store, provider, search.getCandidateMultiplier(), search.getMinCandidates()),
                provider);
    }

    /**
     * Opens the JSON store named by {@code storage.path} and builds the configured provider.
     *
     * @throws ConfigurationException when the index type or provider settings are invalid
     */
    public static SemanticStore open(AppConfig config, Map<String, String> environment) {
        VectorIndexType indexType;
        try {
            indexType = VectorIndexType.parse(config.getStorage().getVectorIndex());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
        SemanticProvider provider = SemanticProviders.create(config, environment);
        Path storePath = Path.of(config.getStorage().getPath()).toAbsolutePath();
        log.info("Opening store at {} with {} vector index", storePath, indexType.configName());
        return new SemanticStore(config, LocalJsonVectorStore.open(storePath, indexType), provider);
    }

    public IndexingStats indexPath(Path target, IndexingOptions options) {
        return indexing.indexPath(target, options);
    }

    public FileIndexUsage indexFile(Path file) {
        return indexing.indexFile(file);
    }

    public List<SearchResult> search(String query, SearchOptions options) {
        return searching.search(query, options);
    }

    /**
     * Search options built from the {@code search} configuration section.
     */
    public SearchOptions defaultSearchOptions() {
        AppConfig.SearchConfig search = config.getSearch();
        return new SearchOptions(search.getTopK(), search.getMinSimilarity(), search.getMinScore());
    }

    public IndexingOptions defaultIndexingOptions() {
        return IndexingOptions.defaults().withConcurrency(Math.max(1, config.getIndexing().getConcurrency()));
    }

    public Optional<FileRecord> info(String id) {
        return store.getById(id)
                .map(file -> new FileRecord(file.metadata(), file.summary(), store.embeddingFor(id).orElse(new float[0])));
    }

    public int count() {
        return store.count();
    }

    public int vectorCount() {
        return store.vectorCount();
    }

    public boolean hasVectorIndex() {
        return store.hasVectorIndex();
    }

    public StoreStats getStats() {
        int total = store.count();
        int vectors = store.vectorCount();
        return new StoreStats(
                total,
                vectors,
                StoreStats.coverage(vectors, total),
                store.hasVectorIndex(),
                store.vectorDimension(),
                store.location(),
                store.databaseSize(),
                provider.describe());
    }
}
