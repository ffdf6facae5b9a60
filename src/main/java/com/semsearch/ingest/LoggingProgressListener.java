package com.semsearch.ingest;

import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressListener implements IndexingProgressListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final boolean verbose;

    public LoggingProgressListener(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void onRunStarted(int totalFiles) {
        log.info("Found {} text files", totalFiles);
    }

    @Override
    public void onFileSkipped(Path file, String reason) {
        if (verbose) {
            log.info("Skipped {} ({})", file, reason);
        }
    }

    @Override
    public void onBatchStarted(int batchNumber, int batchSize) {
        if (verbose) {
            log.info("Processing batch {} ({} files)", batchNumber, batchSize);
        }
    }

    @Override
    public void onFileProgress(Path file, String message) {
        log.debug("{}: {}", file.getFileName(), message);
    }

    @Override
    public void onFileCompleted(Path file, Duration duration, FileIndexUsage usage) {
        log.info("Indexed {} in {} ms ({} tokens)", file, duration.toMillis(), usage.total().total());
    }

    @Override
    public void onFileErrored(Path file, Exception error) {
        log.warn("Failed to index {}: {}", file, error.getMessage());
    }

    @Override
    public void onRunCompleted(IndexingStats stats) {
        if (!verbose) {
            return;
        }
        log.info("Indexing finished: completed={}, skipped={}, errored={}, elapsed={} ms, tokens={}",
                stats.completed(),
                stats.skipped(),
                stats.errored(),
                stats.elapsed().toMillis(),
                stats.totalUsage().total());
    }
}
