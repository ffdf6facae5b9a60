package com.semsearch.ingest;

/**
 * Per-file lifecycle within one indexing run: DISCOVERED, then SKIPPED or QUEUED, then PROCESSING, then COMPLETED
 * or ERRORED.
 */
public enum FileState {
    DISCOVERED,
    SKIPPED,
    QUEUED,
    PROCESSING,
    COMPLETED,
    ERRORED;

    public boolean isTerminal() {
        return this == SKIPPED || this == COMPLETED || this == ERRORED;
    }

    boolean canMoveTo(FileState next) {
        return switch (this) {
            case DISCOVERED -> next == SKIPPED || next == QUEUED;
            case QUEUED -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == ERRORED;
            case SKIPPED, COMPLETED, ERRORED -> false;
        };
    }
}
