package com.semsearch.provider;

/**
 * One entry of a rerank answer; {@code score} is on the 0-100 relevance scale.
 */
public record RankedId(String id, double score) {
}
