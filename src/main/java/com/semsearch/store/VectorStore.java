package com.semsearch.store;

import java.util.List;
import java.util.Optional;

/**
 * Persists indexed files and answers nearest-neighbour queries over their embeddings.
 *
 * <p>Lookups return metadata and summary only; the embedding is read separately through
 * {@link #embeddingFor(String)}. Implementations must be safe for concurrent upserts from one process.
 */
public interface VectorStore {

    /**
     * Inserts or replaces the record with the same id.
     *
     * @throws StorageException when the embedding is empty or not finite, or the write fails
     */
    void upsert(FileRecord record);

    Optional<IndexedFile> getById(String id);

    Optional<IndexedFile> getByPath(String absolutePath);

    Optional<float[]> embeddingFor(String id);

    List<IndexedFile> listAll();

    int count();

    int vectorCount();

    boolean hasVectorIndex();

    /**
     * Dimension of the current vector index, or 0 when there is none.
     */
    int vectorDimension();

    /**
     * Up to {@code limit} files ordered by descending cosine similarity to {@code queryEmbedding}.
     */
    List<ScoredFile> retrieveByEmbedding(float[] queryEmbedding, int limit);

    /**
     * Size in bytes of the persisted data, 0 for purely in-memory stores.
     */
    long databaseSize();

    String location();
}
