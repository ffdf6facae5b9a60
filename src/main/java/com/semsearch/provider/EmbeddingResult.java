package com.semsearch.provider;

/**
 * Raw provider vector. Callers normalize before storing or comparing it.
 */
public record EmbeddingResult(float[] vector, TokenUsage usage) {
}
