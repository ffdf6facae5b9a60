package com.semsearch.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.provider.RankedId;
import com.semsearch.provider.RerankCandidate;
import com.semsearch.provider.RerankOutcome;
import com.semsearch.provider.SemanticProvider;
import com.semsearch.store.IndexedFile;
import com.semsearch.store.ScoredFile;

/**
 * Second search stage: reranks the retrieved candidates and joins the scores back onto them.
 *
 * <p>Results are ordered by rerank score, highest first, regardless of the order the provider answered in. Ids the
 * provider invents are dropped, as are repeats of an id already placed.
 */
public class SearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final Retriever retriever;
    private final SemanticProvider provider;

    public SearchOrchestrator(Retriever retriever, SemanticProvider provider) {
        this.retriever = retriever;
        this.provider = provider;
    }

    public List<SearchResult> search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        List<ScoredFile> candidates = retriever.retrieve(query, options.topK(), options.minSimilarity());
        if (candidates.isEmpty()) {
            log.debug("No candidates at or above similarity {}; skipping rerank", options.minSimilarity());
            return List.of();
        }

        Map<String, ScoredFile> byId = new LinkedHashMap<>();
        for (ScoredFile candidate : candidates) {
            byId.putIfAbsent(candidate.file().id(), candidate);
        }
        List<RerankCandidate> rerankInput = byId.values().stream()
                .map(candidate -> new RerankCandidate(candidate.file().id(), candidate.file().summary()))
                .toList();

        RerankOutcome outcome = provider.rerank(query, rerankInput, options.topK());
        if (outcome.isFallback()) {
            log.info("Rerank output unusable ({}); using input order", outcome.fallbackReason());
        }
        return fuse(outcome.ranking(), byId, options);
    }

    static List<SearchResult> fuse(List<RankedId> ranking, Map<String, ScoredFile> byId, SearchOptions options) {
        List<SearchResult> results = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        for (RankedId ranked : ranking) {
            ScoredFile candidate = byId.get(ranked.id());
            if (candidate == null) {
                log.debug("Dropping rerank entry for unknown id {}", ranked.id());
                continue;
            }
            if (!placed.add(ranked.id())) {
                continue;
            }
            IndexedFile file = candidate.file();
            results.add(new SearchResult(file.id(), ranked.score(), candidate.similarity(), file.metadata(), file.summary()));
        }
        return results.stream()
                .filter(result -> result.score() >= options.minScore())
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed()
                        .thenComparing(Comparator.comparingDouble(SearchResult::similarity).reversed()))
                .limit(options.topK())
                .toList();
    }
}
