package com.semsearch.search;

import com.semsearch.store.FileMetadata;

/**
 * @param score rerank relevance, 0-100
 * @param similarity cosine similarity from the vector retrieval stage
 */
public record SearchResult(String id, double score, double similarity, FileMetadata metadata, String summary) {
}
