package com.semsearch.search;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.provider.EmbeddingResult;
import com.semsearch.provider.SemanticProvider;
import com.semsearch.store.ScoredFile;
import com.semsearch.store.VectorStore;
import com.semsearch.store.Vectors;

/**
 * First search stage: embeds the query, over-fetches nearest neighbours and drops those under the similarity floor.
 */
public class Retriever {
    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    public static final int DEFAULT_CANDIDATE_MULTIPLIER = 3;
    public static final int DEFAULT_MIN_CANDIDATES = 10;

    private final VectorStore store;
    private final SemanticProvider provider;
    private final int candidateMultiplier;
    private final int minCandidates;

    public Retriever(VectorStore store, SemanticProvider provider) {
        this(store, provider, DEFAULT_CANDIDATE_MULTIPLIER, DEFAULT_MIN_CANDIDATES);
    }

    public Retriever(VectorStore store, SemanticProvider provider, int candidateMultiplier, int minCandidates) {
        this.store = store;
        this.provider = provider;
        this.candidateMultiplier = Math.max(1, candidateMultiplier);
        this.minCandidates = Math.max(1, minCandidates);
    }

    public List<ScoredFile> retrieve(String query, int topK, double minSimilarity) {
        EmbeddingResult embedding = provider.embed(query);
        float[] queryVector = Vectors.normalize(embedding.vector());
        int limit = candidateLimit(topK);
        List<ScoredFile> candidates = store.retrieveByEmbedding(queryVector, limit);
        List<ScoredFile> kept = candidates.stream()
                .filter(candidate -> candidate.similarity() >= minSimilarity)
                .toList();
        log.debug("Retrieved {} candidates (limit {}), {} at or above similarity {}",
                candidates.size(), limit, kept.size(), minSimilarity);
        return kept;
    }

    int candidateLimit(int topK) {
        return Math.max(topK * candidateMultiplier, minCandidates);
    }
}
