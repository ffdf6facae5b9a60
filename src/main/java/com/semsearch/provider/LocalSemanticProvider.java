package com.semsearch.provider;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline provider with no model behind it: hashed token and trigram embeddings, leading-sentence summaries and
 * lexical-overlap reranking. Deterministic, so results are reproducible without network access.
 */
public class LocalSemanticProvider implements SemanticProvider {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final int SUMMARY_SENTENCES = 3;
    private static final int SUMMARY_LIMIT = 400;

    private final int dimension;

    public LocalSemanticProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public SummaryResult summarize(String text, int maxChars) {
        String body = text == null ? "" : text;
        boolean truncated = maxChars > 0 && body.length() > maxChars;
        if (truncated) {
            body = body.substring(0, maxChars);
        }
        String flattened = body.replaceAll("\\s+", " ").strip();
        String summary = Arrays.stream(SENTENCE_END.split(flattened))
                .limit(SUMMARY_SENTENCES)
                .collect(Collectors.joining(" "));
        if (summary.length() > SUMMARY_LIMIT) {
            summary = summary.substring(0, SUMMARY_LIMIT).strip() + "...";
        }
        long promptTokens = countTokens(body);
        long completionTokens = countTokens(summary);
        return new SummaryResult(summary, truncated, new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens));
    }

    @Override
    public EmbeddingResult embed(String text) {
        float[] vector = new float[dimension];
        String value = text == null ? "" : text;
        for (String token : tokens(value)) {
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }
        long tokens = countTokens(value);
        return new EmbeddingResult(vector, new TokenUsage(tokens, 0, tokens));
    }

    @Override
    public RerankOutcome rerank(String query, List<RerankCandidate> candidates, int topK) {
        Set<String> queryTerms = Set.copyOf(tokens(query));
        List<RankedId> ranking = candidates.stream()
                .map(candidate -> new RankedId(candidate.id(), Math.round(lexicalScore(queryTerms, candidate.summary()) * 100d)))
                .sorted(Comparator.comparingDouble(RankedId::score).reversed())
                .limit(Math.max(0, topK))
                .toList();
        return RerankOutcome.parsed(ranking);
    }

    @Override
    public String describe() {
        return "local (" + dimension + " dimensions)";
    }

    private double lexicalScore(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty() || text == null || text.isBlank()) {
            return 0d;
        }
        Set<String> words = Set.copyOf(tokens(text));
        long matches = queryTerms.stream().filter(words::contains).count();
        return (double) matches / queryTerms.size();
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .toList();
    }

    private static long countTokens(String text) {
        return text.isBlank() ? 0 : text.strip().split("\\s+").length;
    }
}
