package com.semsearch.store;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * On-disk shape of {@link LocalJsonVectorStore}: the primary file table plus the membership of the vector index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreDocument(int version, List<StoredFile> files, IndexState vectorIndex) {
    static final int CURRENT_VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoredFile(FileMetadata metadata, String summary, byte[] embedding) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndexState(String type, int dimension, List<String> ids) {
    }
}
