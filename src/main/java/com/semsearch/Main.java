package com.semsearch;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.ingest.IndexingOptions;
import com.semsearch.ingest.IndexingStats;
import com.semsearch.ingest.LoggingProgressListener;
import com.semsearch.runtime.AppConfig;
import com.semsearch.runtime.ConfigLoader;
import com.semsearch.runtime.ConfigurationException;
import com.semsearch.search.SearchOptions;
import com.semsearch.search.SearchResult;
import com.semsearch.store.FileRecord;
import com.semsearch.store.VectorIndexType;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "semsearch",
        mixinStandardHelpOptions = true,
        version = "semsearch 0.3.2",
        description = "Index local text files by summary and embedding, then search them by meaning.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "semsearch.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--path", description = "File or directory to index", defaultValue = ".")
    Path path;

    @Option(names = "--concurrency", description = "Files processed at once while indexing")
    Integer concurrency;

    @Option(names = "--force", description = "Reprocess files that are already indexed", defaultValue = "false")
    boolean force;

    @Option(names = "--max-chars", description = "Characters of each file sent for summarization")
    Integer maxChars;

    @Option(names = "--verbose", description = "Log per-file progress while indexing", defaultValue = "false")
    boolean verbose;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Results to return")
    Integer topK;

    @Option(names = "--min-similarity", description = "Minimum cosine similarity, 0 to 1")
    Double minSimilarity;

    @Option(names = "--min-score", description = "Minimum rerank score, 0 to 100")
    Double minScore;

    @Option(names = "--id", description = "Record id used in info mode")
    String id;

    private final Map<String, String> environment;

    enum Mode {
        index,
        search,
        info,
        status
    }

    public Main() {
        this(System.getenv());
    }

    Main(Map<String, String> environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = new ConfigLoader().load(configPath, environment);
        if (maxChars != null) {
            if (maxChars < 1) {
                return usageError("--max-chars must be at least 1");
            }
            config.getIndexing().setMaxChars(maxChars);
        }
        log.debug("Starting semsearch in {} mode with config {}", mode, configPath);

        try {
            switch (mode) {
                case index:
                    return runIndex(config);
                case search:
                    return runSearch(config);
                case info:
                    return runInfo(config);
                case status:
                default:
                    return runStatus(config);
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return usageError(e.getMessage());
        }
    }

    private int runIndex(AppConfig config) {
        int width = concurrency == null ? config.getIndexing().getConcurrency() : concurrency;
        if (width < 1) {
            return usageError("--concurrency must be at least 1");
        }
        SemanticStore store = SemanticStore.open(config, environment);
        IndexingOptions options = new IndexingOptions(width, force, new LoggingProgressListener(verbose));
        IndexingStats stats = store.indexPath(path, options);

        PrintWriter out = out();
        out.printf(Locale.ROOT, "Indexed %d of %d files (%d skipped, %d errored) in %.1fs%n",
                stats.completed(), stats.totalFiles(), stats.skipped(), stats.errored(),
                stats.elapsed().toMillis() / 1000.0);
        out.printf(Locale.ROOT, "Tokens: summary=%d embedding=%d total=%d%n",
                stats.summaryUsage().total(), stats.embeddingUsage().total(), stats.totalUsage().total());
        stats.errors().forEach(error -> out.printf("  failed %s: %s%n", error.path(), error.message()));
        out.flush();
        return stats.errored() == 0 ? 0 : 1;
    }

    private int runSearch(AppConfig config) {
        if (query == null || query.isBlank()) {
            return usageError("--query is required in search mode");
        }
        if (topK != null && topK < 1) {
            return usageError("--top-k must be at least 1");
        }
        if (minSimilarity != null && (minSimilarity < 0d || minSimilarity > 1d)) {
            return usageError("--min-similarity must be between 0 and 1");
        }
        if (minScore != null && (minScore < 0d || minScore > 100d)) {
            return usageError("--min-score must be between 0 and 100");
        }
        SemanticStore store = SemanticStore.open(config, environment);
        SearchOptions options = store.defaultSearchOptions();
        if (topK != null) {
            options = options.withTopK(topK);
        }
        if (minSimilarity != null) {
            options = options.withMinSimilarity(minSimilarity);
        }
        if (minScore != null) {
            options = options.withMinScore(minScore);
        }

        List<SearchResult> results = store.search(query, options);
        PrintWriter out = out();
        if (results.isEmpty()) {
            out.println("No results.");
        }
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            out.printf(Locale.ROOT, "#%d %s score=%.0f similarity=%.4f id=%s%n",
                    i + 1, result.metadata().path(), result.score(), result.similarity(), result.id());
            out.printf("   %s%n", result.summary());
        }
        out.flush();
        return 0;
    }

    private int runInfo(AppConfig config) {
        if (id == null || id.isBlank()) {
            return usageError("--id is required in info mode");
        }
        SemanticStore store = SemanticStore.open(config, environment);
        Optional<FileRecord> record = store.info(id.strip());
        PrintWriter out = out();
        if (record.isEmpty()) {
            out.printf("Not found: %s%n", id);
            out.flush();
            return 1;
        }
        FileRecord file = record.get();
        out.printf("id:        %s%n", file.id());
        out.printf("path:      %s%n", file.metadata().path());
        out.printf("mimetype:  %s%n", file.metadata().mimetype());
        out.printf("size:      %d%n", file.metadata().size());
        out.printf("created:   %s%n", file.metadata().createdAt());
        out.printf("modified:  %s%n", file.metadata().modifiedAt());
        out.printf("embedding: %d dimensions%n", file.embedding().length);
        out.printf("summary:   %s%n", file.summary());
        out.flush();
        return 0;
    }

    private int runStatus(AppConfig config) {
        SemanticStore store = SemanticStore.open(config, environment);
        StoreStats stats = store.getStats();
        PrintWriter out = out();
        out.printf("Database:        %s (%d bytes)%n", stats.databasePath(), stats.databaseSize());
        out.printf("Endpoint:        %s%n", stats.endpoint());
        out.printf("Documents:       %d%n", stats.totalDocuments());
        out.printf("Vector index:    %s, %d vectors, %d dimensions%n",
                stats.hasVectorIndex() ? "present" : "absent", stats.vectorCount(), stats.vectorDimension());
        out.printf("Index coverage:  %d%%%n", stats.vectorIndexCoverage());
        boolean indexEnabled = VectorIndexType.parse(config.getStorage().getVectorIndex()) != VectorIndexType.NONE;
        if (!indexEnabled) {
            out.println("Vector index disabled (storage.vectorIndex: none); search scans stored embeddings.");
        } else if (stats.totalDocuments() > 0 && !stats.fullyCovered()) {
            out.println("Note: some documents are missing from the vector index. Re-index with --force to rebuild it.");
        }
        out.flush();
        return 0;
    }

    private int usageError(String message) {
        PrintWriter err = spec == null ? new PrintWriter(System.err, true) : spec.commandLine().getErr();
        err.println(message);
        err.flush();
        return 2;
    }

    private PrintWriter out() {
        return spec == null ? new PrintWriter(System.out, true) : spec.commandLine().getOut();
    }
}
