package com.semsearch.store;

import java.time.Instant;

/**
 * Filesystem facts captured when a file is indexed. {@code path} is absolute and unique per store.
 */
public record FileMetadata(
        String id,
        String path,
        String filename,
        String mimetype,
        long size,
        Instant createdAt,
        Instant modifiedAt) {

    public FileMetadata withId(String newId) {
        return new FileMetadata(newId, path, filename, mimetype, size, createdAt, modifiedAt);
    }
}
