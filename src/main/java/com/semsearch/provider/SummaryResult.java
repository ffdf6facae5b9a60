package com.semsearch.provider;

/**
 * @param truncated true when the text handed to the model was cut to the requested character budget
 */
public record SummaryResult(String summary, boolean truncated, TokenUsage usage) {
}
