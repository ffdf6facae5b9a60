package com.semsearch.store;

import java.util.List;
import java.util.Set;

/**
 * Nearest-neighbour structure bound to one embedding dimension.
 */
public interface VectorIndex {
    int dimension();

    /**
     * @throws IllegalArgumentException when {@code vector} does not have {@link #dimension()} entries
     */
    void put(String id, float[] vector);

    int size();

    Set<String> ids();

    /**
     * Closest entries first, by cosine distance ({@code 1 - dot} for unit vectors).
     */
    List<Neighbor> nearest(float[] query, int limit);

    String type();

    record Neighbor(String id, float distance) {
    }
}
