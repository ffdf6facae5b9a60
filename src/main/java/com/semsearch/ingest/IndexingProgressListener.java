package com.semsearch.ingest;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Receives indexing events. Callbacks for different files can arrive concurrently from worker threads.
 */
public interface IndexingProgressListener {
    IndexingProgressListener NONE = new IndexingProgressListener() {
    };

    default void onRunStarted(int totalFiles) {
    }

    default void onFileSkipped(Path file, String reason) {
    }

    default void onBatchStarted(int batchNumber, int batchSize) {
    }

    default void onFileStarted(Path file) {
    }

    default void onFileProgress(Path file, String message) {
    }

    default void onFileCompleted(Path file, Duration duration, FileIndexUsage usage) {
    }

    default void onFileErrored(Path file, Exception error) {
    }

    default void onRunCompleted(IndexingStats stats) {
    }
}
