package com.semsearch.store;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class FlatVectorIndex implements VectorIndex {
    private final int dimension;
    private final Map<String, float[]> vectors = new LinkedHashMap<>();

    public FlatVectorIndex(int dimension) {
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
        vectors.put(id, vector);
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
        return vectors.entrySet().stream()
                .map(entry -> new Neighbor(entry.getKey(), Vectors.cosineDistance(query, entry.getValue())))
                .sorted(Comparator.comparing(Neighbor::distance))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public String type() {
        return VectorIndexType.FLAT.configName();
    }
}
