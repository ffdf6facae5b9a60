package com.semsearch.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.provider.EmbeddingResult;
import com.semsearch.provider.SemanticProvider;
import com.semsearch.provider.SummaryResult;
import com.semsearch.store.FileMetadata;
import com.semsearch.store.FileRecord;
import com.semsearch.store.IndexedFile;
import com.semsearch.store.VectorStore;
import com.semsearch.store.Vectors;

/**
 * Turns a file or directory into stored records. Files are processed in batches of {@code concurrency}; the files
 * of one batch run in parallel and the next batch starts only once every file of the current one has finished.
 * A failure is recorded against its file and never stops the run.
 */
public class IndexingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IndexingOrchestrator.class);

    private final VectorStore store;
    private final SemanticProvider provider;
    private final TextExtractor extractor;
    private final FileTypes fileTypes;
    private final ChangeDetector changeDetector;
    private final int maxChars;

    public IndexingOrchestrator(VectorStore store, SemanticProvider provider, TextExtractor extractor, FileTypes fileTypes, int maxChars) {
        this.store = store;
        this.provider = provider;
        this.extractor = extractor;
        this.fileTypes = fileTypes;
        this.changeDetector = new ChangeDetector(store);
        this.maxChars = maxChars;
    }

    public IndexingStats indexPath(Path target, IndexingOptions options) {
        return indexFiles(discover(target), options);
    }

    /**
     * Indexes the given files in order. Entries are not de-duplicated: a path listed twice is processed twice and
     * the later write wins.
     */
    public IndexingStats indexFiles(List<Path> files, IndexingOptions options) {
        List<Path> textFiles = files.stream()
                .map(file -> file.toAbsolutePath().normalize())
                .filter(fileTypes::isTextLike)
                .toList();
        log.debug("{} of {} files pass the type filter", textFiles.size(), files.size());

        IndexingProgress progress = new IndexingProgress(textFiles.size(), options.listener());
        progress.start();

        List<IndexingProgress.TrackedFile> queued = new ArrayList<>();
        for (Path file : textFiles) {
            IndexingProgress.TrackedFile tracked = progress.discover(file);
            if (changeDetector.needsProcessing(file, options.force())) {
                progress.queue(tracked);
                queued.add(tracked);
            } else {
                progress.skip(tracked, "already indexed");
            }
        }

        if (!queued.isEmpty()) {
            runBatches(queued, options.concurrency(), progress);
        }

        IndexingStats stats = progress.finish();
        log.info("Indexing run finished: total={}, completed={}, skipped={}, errored={}, elapsedMs={}",
                stats.totalFiles(), stats.completed(), stats.skipped(), stats.errored(), stats.elapsed().toMillis());
        return stats;
    }

    /**
     * Indexes one file unconditionally, keeping the id of an existing record for the same path.
     *
     * @throws ExtractionException when the file cannot be read as text
     * @throws com.semsearch.provider.ProviderException when summarizing or embedding fails
     * @throws com.semsearch.store.StorageException when the record cannot be written
     */
    public FileIndexUsage indexFile(Path file) {
        return indexFile(file.toAbsolutePath().normalize(), message -> log.debug("{}: {}", file, message));
    }

    private void runBatches(List<IndexingProgress.TrackedFile> queued, int concurrency, IndexingProgress progress) {
        int width = Math.min(concurrency, queued.size());
        ExecutorService executor = Executors.newFixedThreadPool(width, new IndexingThreadFactory());
        try {
            for (int from = 0; from < queued.size(); from += concurrency) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Indexing interrupted; {} files were not started", queued.size() - from);
                    break;
                }
                List<IndexingProgress.TrackedFile> batch = queued.subList(from, Math.min(from + concurrency, queued.size()));
                progress.batchStarted(from / concurrency + 1, batch.size());

                List<Callable<Void>> tasks = new ArrayList<>();
                for (IndexingProgress.TrackedFile file : batch) {
                    tasks.add(() -> {
                        processTracked(file, progress);
                        return null;
                    });
                }
                try {
                    executor.invokeAll(tasks);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Indexing interrupted during batch {}", from / concurrency + 1);
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private void processTracked(IndexingProgress.TrackedFile file, IndexingProgress progress) {
        progress.startFile(file);
        long start = System.nanoTime();
        try {
            FileIndexUsage usage = indexFile(file.path(), message -> progress.update(file, message));
            progress.complete(file, Duration.ofNanos(System.nanoTime() - start), usage);
        } catch (RuntimeException e) {
            log.warn("Indexing {} failed: {}", file.path(), e.getMessage());
            log.debug("Failure detail for {}", file.path(), e);
            progress.error(file, e);
        }
    }

    private FileIndexUsage indexFile(Path resolved, Consumer<String> onProgress) {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(resolved, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new ExtractionException("Unable to stat " + resolved, e);
        }
        Optional<IndexedFile> existing = store.getByPath(resolved.toString());
        String id = existing.map(IndexedFile::id).orElseGet(() -> UUID.randomUUID().toString());

        onProgress.accept("Reading file...");
        ExtractedText extracted = extractor.extract(resolved, maxChars);
        onProgress.accept("Generating summary...");
        SummaryResult summary = provider.summarize(extracted.text(), maxChars);
        onProgress.accept("Computing embeddings...");
        EmbeddingResult embedding = provider.embed(summary.summary());

        Instant createdAt = existing
                .map(file -> file.metadata().createdAt())
                .orElse(attributes.creationTime().toInstant());
        FileMetadata metadata = new FileMetadata(
                id,
                resolved.toString(),
                resolved.getFileName().toString(),
                FileTypes.mimeType(resolved),
                attributes.size(),
                createdAt,
                attributes.lastModifiedTime().toInstant());
        store.upsert(new FileRecord(metadata, summary.summary(), Vectors.normalize(embedding.vector())));
        return new FileIndexUsage(summary.usage(), embedding.usage());
    }

    private List<Path> discover(Path target) {
        if (!Files.exists(target)) {
            throw new ExtractionException("Path does not exist: " + target);
        }
        if (!Files.isDirectory(target)) {
            return List.of(target);
        }
        try (Stream<Path> walk = Files.walk(target)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new ExtractionException("Unable to list " + target, e);
        } catch (UncheckedIOException e) {
            throw new ExtractionException("Unable to list " + target, e.getCause());
        }
    }

    private static final class IndexingThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "semsearch-index-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
