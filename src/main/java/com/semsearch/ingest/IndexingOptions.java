package com.semsearch.ingest;

/**
 * @param concurrency number of files processed at once; batches of this width run one after another
 * @param force reprocess files that already have a record
 */
public record IndexingOptions(int concurrency, boolean force, IndexingProgressListener listener) {
    public static final int DEFAULT_CONCURRENCY = 3;

    public IndexingOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        listener = listener == null ? IndexingProgressListener.NONE : listener;
    }

    public static IndexingOptions defaults() {
        return new IndexingOptions(DEFAULT_CONCURRENCY, false, IndexingProgressListener.NONE);
    }

    public IndexingOptions withConcurrency(int value) {
        return new IndexingOptions(value, force, listener);
    }

    public IndexingOptions withForce(boolean value) {
        return new IndexingOptions(concurrency, value, listener);
    }

    public IndexingOptions withListener(IndexingProgressListener value) {
        return new IndexingOptions(concurrency, force, value);
    }
}
