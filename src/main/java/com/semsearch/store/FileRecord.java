package com.semsearch.store;

/**
 * A file together with its summary and unit-length embedding, as written to a {@link VectorStore}.
 */
public record FileRecord(FileMetadata metadata, String summary, float[] embedding) {
    public String id() {
        return metadata.id();
    }

    public IndexedFile withoutEmbedding() {
        return new IndexedFile(metadata, summary);
    }
}
