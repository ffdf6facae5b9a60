package com.semsearch.ingest;

import java.time.Duration;
import java.util.List;

import com.semsearch.provider.TokenUsage;

/**
 * Counters for one indexing run. {@code totalFiles} counts files that passed the type filter.
 */
public record IndexingStats(
        int totalFiles,
        int started,
        int completed,
        int skipped,
        int errored,
        Duration elapsed,
        TokenUsage summaryUsage,
        TokenUsage embeddingUsage,
        List<FileError> errors) {

    public TokenUsage totalUsage() {
        return summaryUsage.plus(embeddingUsage);
    }

    public int pending() {
        return totalFiles - completed - skipped - errored;
    }
}
