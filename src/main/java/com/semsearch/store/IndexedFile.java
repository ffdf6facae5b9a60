package com.semsearch.store;

public record IndexedFile(FileMetadata metadata, String summary) {
    public String id() {
        return metadata.id();
    }
}
