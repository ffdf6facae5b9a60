package com.semsearch.provider;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Hand-written provider for tests: scripted embeddings and rerank answers, call counters and a concurrency probe.
 */
public class ScriptedSemanticProvider implements SemanticProvider {
    public final AtomicInteger summarizeCalls = new AtomicInteger();
    public final AtomicInteger embedCalls = new AtomicInteger();
    public final AtomicInteger rerankCalls = new AtomicInteger();
    public final AtomicInteger maxConcurrentSummaries = new AtomicInteger();
    public final List<String> summarizedTexts = new CopyOnWriteArrayList<>();
    public final List<List<RerankCandidate>> rerankInputs = new CopyOnWriteArrayList<>();

    private final AtomicInteger activeSummaries = new AtomicInteger();
    private Function<String, float[]> embedder = text -> new float[] { 1f, 0f, 0f };
    private BiFunction<List<RerankCandidate>, Integer, RerankOutcome> reranker =
            (candidates, topK) -> RerankOutcome.fallbackUsed(RerankOutputParser.uniformRanking(candidates, topK), "scripted");
    private Predicate<String> failSummaryWhen = text -> false;
    private long summaryDelayMs;

    public ScriptedSemanticProvider embedWith(Function<String, float[]> value) {
        this.embedder = value;
        return this;
    }

    public ScriptedSemanticProvider rerankWith(BiFunction<List<RerankCandidate>, Integer, RerankOutcome> value) {
        this.reranker = value;
        return this;
    }

    public ScriptedSemanticProvider failSummaryWhen(Predicate<String> value) {
        this.failSummaryWhen = value;
        return this;
    }

    public ScriptedSemanticProvider summaryDelayMs(long value) {
        this.summaryDelayMs = value;
        return this;
    }

    @Override
    public SummaryResult summarize(String text, int maxChars) {
        summarizeCalls.incrementAndGet();
        summarizedTexts.add(text);
        int active = activeSummaries.incrementAndGet();
        maxConcurrentSummaries.accumulateAndGet(active, Math::max);
        try {
            if (summaryDelayMs > 0) {
                Thread.sleep(summaryDelayMs);
            }
            if (failSummaryWhen.test(text)) {
                throw new ProviderException("scripted failure for: " + text.strip());
            }
            return new SummaryResult("summary: " + text.strip(), false, new TokenUsage(10, 5, 15));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted", e);
        } finally {
            activeSummaries.decrementAndGet();
        }
    }

    @Override
    public EmbeddingResult embed(String text) {
        embedCalls.incrementAndGet();
        return new EmbeddingResult(embedder.apply(text), new TokenUsage(4, 0, 4));
    }

    @Override
    public RerankOutcome rerank(String query, List<RerankCandidate> candidates, int topK) {
        rerankCalls.incrementAndGet();
        rerankInputs.add(List.copyOf(candidates));
        return reranker.apply(candidates, topK);
    }

    @Override
    public String describe() {
        return "scripted";
    }
}
