package com.semsearch.provider;

import java.util.List;

/**
 * Language-model operations the store depends on. Implementations are shared by concurrent indexing tasks and must
 * be thread-safe. Failures are reported as {@link ProviderException}; nothing is retried here.
 */
public interface SemanticProvider {

    /**
     * Short factual summary of {@code text}, using at most {@code maxChars} characters of it.
     */
    SummaryResult summarize(String text, int maxChars);

    EmbeddingResult embed(String text);

    /**
     * Scores each candidate 0-100 against {@code query} and returns at most {@code topK} entries, best first.
     * Unusable model output yields {@link RerankOutcome.Kind#FALLBACK_USED} rather than an exception.
     */
    RerankOutcome rerank(String query, List<RerankCandidate> candidates, int topK);

    /**
     * Human-readable target of this provider, e.g. the endpoint URL.
     */
    String describe();
}
