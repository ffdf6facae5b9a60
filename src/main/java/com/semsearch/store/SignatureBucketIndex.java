package com.semsearch.store;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Buckets vectors by the sign pattern of their first 16 components and probes the query bucket plus a few
 * neighbouring patterns. Small indexes, and probes that come back thin, fall back to a full scan, so results are
 * exact whenever the candidate pool would otherwise be too small.
 */
public class SignatureBucketIndex implements VectorIndex {
    private static final int SIGNATURE_BITS = 16;
    private static final int FULL_SCAN_THRESHOLD = 150;

    private final int dimension;
    private final Map<String, float[]> vectors = new LinkedHashMap<>();
    private final Map<String, Integer> signatures = new HashMap<>();
    private final Map<Integer, Set<String>> buckets = new HashMap<>();

    public SignatureBucketIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void put(String id, float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException("Expected " + dimension + " dimensions, got " + vector.length);
        }
        Integer previous = signatures.get(id);
        if (previous != null) {
            Set<String> bucket = buckets.get(previous);
            if (bucket != null) {
                bucket.remove(id);
            }
        }
        int signature = signature(vector);
        vectors.put(id, vector);
        signatures.put(id, signature);
        buckets.computeIfAbsent(signature, unused -> new HashSet<>()).add(id);
    }

    @Override
    public int size() {
        return vectors.size();
    }

    @Override
    public Set<String> ids() {
        return Set.copyOf(vectors.keySet());
    }

    @Override
    public List<Neighbor> nearest(float[] query, int limit) {
        return candidateIds(query, limit).stream()
                .map(id -> new Neighbor(id, Vectors.cosineDistance(query, vectors.get(id))))
                .sorted(Comparator.comparing(Neighbor::distance))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public String type() {
        return VectorIndexType.BUCKETED.configName();
    }

    private Set<String> candidateIds(float[] query, int limit) {
        if (vectors.size() <= Math.max(FULL_SCAN_THRESHOLD, limit * 20)) {
            return vectors.keySet();
        }
        Set<String> candidates = new HashSet<>();
        int querySignature = signature(query);
        List<Integer> probes = List.of(querySignature, querySignature ^ 0x00FF, querySignature ^ 0xFF00, querySignature ^ 0x0F0F);
        for (Integer probe : probes) {
            candidates.addAll(buckets.getOrDefault(probe, Set.of()));
        }
        if (candidates.size() < limit * 5) {
            return vectors.keySet();
        }
        return candidates;
    }

    static int signature(float[] vector) {
        int signature = 0;
        for (int i = 0; i < Math.min(SIGNATURE_BITS, vector.length); i++) {
            if (vector[i] >= 0f) {
                signature |= (1 << i);
            }
        }
        return signature;
    }
}
