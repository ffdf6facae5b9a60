package com.semsearch.search;

/**
 * @param minSimilarity inclusive cosine floor applied before reranking
 * @param minScore inclusive floor on the 0-100 rerank score
 */
public record SearchOptions(int topK, double minSimilarity, double minScore) {
    public static final int DEFAULT_TOP_K = 5;
    public static final double DEFAULT_MIN_SIMILARITY = 0.0;
    public static final double DEFAULT_MIN_SCORE = 0.0;

    public SearchOptions {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1: " + topK);
        }
        if (minSimilarity < -1d || minSimilarity > 1d) {
            throw new IllegalArgumentException("minSimilarity must be within [-1, 1]: " + minSimilarity);
        }
        if (minScore < 0d || minScore > 100d) {
            throw new IllegalArgumentException("minScore must be within [0, 100]: " + minScore);
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_TOP_K, DEFAULT_MIN_SIMILARITY, DEFAULT_MIN_SCORE);
    }

    public SearchOptions withTopK(int value) {
        return new SearchOptions(value, minSimilarity, minScore);
    }

    public SearchOptions withMinSimilarity(double value) {
        return new SearchOptions(topK, value, minScore);
    }

    public SearchOptions withMinScore(double value) {
        return new SearchOptions(topK, minSimilarity, value);
    }
}
