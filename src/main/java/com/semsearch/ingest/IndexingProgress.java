package com.semsearch.ingest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.provider.TokenUsage;

/**
 * Thread-safe bookkeeping for one indexing run: per-file state, counters and token usage, forwarded to a
 * {@link IndexingProgressListener}.
 */
public class IndexingProgress {
    private static final Logger log = LoggerFactory.getLogger(IndexingProgress.class);

    private final int totalFiles;
    private final IndexingProgressListener listener;
    private final Map<TrackedFile, FileState> states = new ConcurrentHashMap<>();
    private final AtomicInteger ordinals = new AtomicInteger();
    private final List<FileError> errors = new ArrayList<>();
    private long startNanos;
    private int started;
    private int completed;
    private int skipped;
    private int errored;
    private TokenUsage summaryUsage = TokenUsage.NONE;
    private TokenUsage embeddingUsage = TokenUsage.NONE;

    public IndexingProgress(int totalFiles, IndexingProgressListener listener) {
        this.totalFiles = totalFiles;
        this.listener = listener == null ? IndexingProgressListener.NONE : listener;
    }

    public synchronized void start() {
        startNanos = System.nanoTime();
        notifyListener(l -> l.onRunStarted(totalFiles));
    }

    /**
     * Registers one occurrence of {@code file}. The same path listed twice is tracked as two entries.
     */
    public TrackedFile discover(Path file) {
        TrackedFile tracked = new TrackedFile(ordinals.getAndIncrement(), file);
        states.put(tracked, FileState.DISCOVERED);
        return tracked;
    }

    public void skip(TrackedFile file, String reason) {
        transition(file, FileState.SKIPPED);
        synchronized (this) {
            skipped++;
        }
        notifyListener(l -> l.onFileSkipped(file.path(), reason));
    }

    public void queue(TrackedFile file) {
        transition(file, FileState.QUEUED);
    }

    public void batchStarted(int batchNumber, int batchSize) {
        notifyListener(l -> l.onBatchStarted(batchNumber, batchSize));
    }

    public void startFile(TrackedFile file) {
        transition(file, FileState.PROCESSING);
        synchronized (this) {
            started++;
        }
        notifyListener(l -> l.onFileStarted(file.path()));
    }

    public void update(TrackedFile file, String message) {
        notifyListener(l -> l.onFileProgress(file.path(), message));
    }

    public void complete(TrackedFile file, Duration duration, FileIndexUsage usage) {
        transition(file, FileState.COMPLETED);
        synchronized (this) {
            completed++;
            summaryUsage = summaryUsage.plus(usage.summary());
            embeddingUsage = embeddingUsage.plus(usage.embedding());
        }
        notifyListener(l -> l.onFileCompleted(file.path(), duration, usage));
    }

    public void error(TrackedFile file, Exception error) {
        transition(file, FileState.ERRORED);
        synchronized (this) {
            errored++;
            errors.add(new FileError(file.path().toString(), error.getClass().getSimpleName(), String.valueOf(error.getMessage())));
        }
        notifyListener(l -> l.onFileErrored(file.path(), error));
    }

    public FileState state(TrackedFile file) {
        return states.get(file);
    }

    public synchronized IndexingStats snapshot() {
        return new IndexingStats(
                totalFiles,
                started,
                completed,
                skipped,
                errored,
                Duration.ofNanos(System.nanoTime() - startNanos),
                summaryUsage,
                embeddingUsage,
                List.copyOf(errors));
    }

    public IndexingStats finish() {
        IndexingStats stats = snapshot();
        notifyListener(l -> l.onRunCompleted(stats));
        return stats;
    }

    private void transition(TrackedFile file, FileState next) {
        states.compute(file, (key, current) -> {
            if (current == null) {
                throw new IllegalStateException(file.path() + " was never discovered");
            }
            if (!current.canMoveTo(next)) {
                throw new IllegalStateException("Cannot move " + file.path() + " from " + current + " to " + next);
            }
            return next;
        });
    }

    private void notifyListener(Consumer<IndexingProgressListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed", e);
        }
    }

    public record TrackedFile(int ordinal, Path path) {
    }
}
